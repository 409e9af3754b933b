package com.github.typetrace.parser;

import com.github.typetrace.SyntaxException;
import com.github.typetrace.Tokenizer.Token;
import com.github.typetrace.Tokenizer.TokenType;
import com.github.typetrace.Tokenizer.Tokens;
import com.github.typetrace.parser.SyntaxTree.ApplicationExpression;
import com.github.typetrace.parser.SyntaxTree.BinaryExpression;
import com.github.typetrace.parser.SyntaxTree.BooleanExpression;
import com.github.typetrace.parser.SyntaxTree.ConsExpression;
import com.github.typetrace.parser.SyntaxTree.EmptyListExpression;
import com.github.typetrace.parser.SyntaxTree.Expression;
import com.github.typetrace.parser.SyntaxTree.FunctionExpression;
import com.github.typetrace.parser.SyntaxTree.IfExpression;
import com.github.typetrace.parser.SyntaxTree.LetExpression;
import com.github.typetrace.parser.SyntaxTree.NodeId;
import com.github.typetrace.parser.SyntaxTree.NumberExpression;
import com.github.typetrace.parser.SyntaxTree.VariableExpression;

/**
 * Recursive descent over four layers: expression forms ({@code let}, {@code fun}, {@code if}),
 * binary operators, application and atoms.
 * <p>
 * All binary operators share one precedence level and associate to the right, so
 * {@code 1 - 2 - 3} is {@code 1 - (2 - 3)} and {@code 2 * 3 + 4} is {@code 2 * (3 + 4)}.
 * {@code ::} is one of them; only list literals build {@link ConsExpression} nodes.
 */
public class Parser {

    private int nextId;

    public SyntaxTree parse(Tokens tokens) {
        nextId = 0;
        var root = parseExpression(tokens);
        tokens.peek(TokenType.EOF);
        return new SyntaxTree(root);
    }

    Expression parseExpression(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case LET -> parseLetExpression(tokens);
            case FUN -> parseFunctionExpression(tokens);
            case IF -> parseIfExpression(tokens);
            default -> parseBinary(tokens);
        };
    }

    // <> let name = expression in expression
    private Expression parseLetExpression(Tokens tokens) {
        tokens.next(TokenType.LET);
        var nameToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.EQUALS);
        var value = parseExpression(tokens);
        tokens.next(TokenType.IN);
        var body = parseExpression(tokens);
        return new LetExpression(id(), nameToken.image(), value, body);
    }

    // <> fun name -> expression
    private Expression parseFunctionExpression(Tokens tokens) {
        tokens.next(TokenType.FUN);
        var parameterToken = tokens.next(TokenType.IDENTIFIER);
        tokens.next(TokenType.ARROW);
        var body = parseExpression(tokens);
        return new FunctionExpression(id(), parameterToken.image(), body);
    }

    // <> if expression then expression else expression
    private Expression parseIfExpression(Tokens tokens) {
        tokens.next(TokenType.IF);
        var condition = parseExpression(tokens);
        tokens.next(TokenType.THEN);
        var thenBranch = parseExpression(tokens);
        tokens.next(TokenType.ELSE);
        var elseBranch = parseExpression(tokens);
        return new IfExpression(id(), condition, thenBranch, elseBranch);
    }

    private Expression parseBinary(Tokens tokens) {
        var left = parseApplication(tokens);

        if (tokens.peek().type().isBinaryOperator()) {
            var operator = tokens.next().type();
            var right = parseBinary(tokens);
            return new BinaryExpression(id(), left, operator, right);
        }
        return left;
    }

    // f x y is (f x) y
    private Expression parseApplication(Tokens tokens) {
        var expression = parseAtom(tokens);

        while (tokens.peek().type().startsAtom()) {
            var argument = parseAtom(tokens);
            expression = new ApplicationExpression(id(), expression, argument);
        }
        return expression;
    }

    private Expression parseAtom(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case NUMBER -> {
                tokens.next();
                yield new NumberExpression(id(), parseNumber(token));
            }
            case TRUE, FALSE -> {
                tokens.next();
                yield new BooleanExpression(id(), token.type() == TokenType.TRUE);
            }
            case IDENTIFIER -> {
                tokens.next();
                yield new VariableExpression(id(), token.image());
            }
            case LPAREN -> {
                tokens.next(TokenType.LPAREN);
                var e = parseExpression(tokens);
                tokens.next(TokenType.RPAREN);
                yield e;
            }
            case LBRACKET -> parseListLiteral(tokens);
            default -> throw new SyntaxException("an expression", token);
        };
    }

    // <> "[" "]" | "[" expression "]" | "[" expression "," expression "]"
    private Expression parseListLiteral(Tokens tokens) {
        tokens.next(TokenType.LBRACKET);
        if (tokens.matches(TokenType.RBRACKET)) {
            tokens.next();
            return new EmptyListExpression(id());
        }

        var head = parseExpression(tokens);
        Expression tail;
        if (tokens.matches(TokenType.COMMA)) {
            tokens.next();
            var second = parseExpression(tokens);
            tail = new ConsExpression(id(), second, new EmptyListExpression(id()));
        } else {
            tail = new EmptyListExpression(id());
        }
        tokens.next(TokenType.RBRACKET);
        return new ConsExpression(id(), head, tail);
    }

    private static int parseNumber(Token token) {
        try {
            return Integer.parseInt(token.image());
        } catch (NumberFormatException e) {
            throw new SyntaxException("an integer literal in range", token);
        }
    }

    private NodeId id() {
        return new NodeId(nextId++);
    }

}
