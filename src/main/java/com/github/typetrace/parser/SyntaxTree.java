package com.github.typetrace.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.github.typetrace.Tokenizer.TokenType;

public record SyntaxTree(Expression root) {

    /** Identity of a node within one parse, handed out in construction order. */
    public record NodeId(int value) {
        @Override
        public String toString() {
            return "#" + value;
        }
    }

    public sealed interface Expression {
        NodeId id();
        String label();
        List<Expression> children();
        <C, R> R accept(Visitor<C, R> visitor, C context);
    }

    public interface Visitor<C, R> {
        R visitNumber(NumberExpression e, C context);
        R visitBoolean(BooleanExpression e, C context);
        R visitVariable(VariableExpression e, C context);
        R visitBinary(BinaryExpression e, C context);
        R visitIf(IfExpression e, C context);
        R visitFunction(FunctionExpression e, C context);
        R visitLet(LetExpression e, C context);
        R visitApplication(ApplicationExpression e, C context);
        R visitEmptyList(EmptyListExpression e, C context);
        R visitCons(ConsExpression e, C context);
    }

    public record NumberExpression(NodeId id, int number) implements Expression {
        public String label() { return "Int(" + number + ")"; }
        public List<Expression> children() { return List.of(); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitNumber(this, context); }
    }

    public record BooleanExpression(NodeId id, boolean value) implements Expression {
        public String label() { return "Bool(" + value + ")"; }
        public List<Expression> children() { return List.of(); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitBoolean(this, context); }
    }

    public record VariableExpression(NodeId id, String name) implements Expression {
        public String label() { return "Var(" + name + ")"; }
        public List<Expression> children() { return List.of(); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitVariable(this, context); }
    }

    public record BinaryExpression(NodeId id, Expression left, TokenType operator, Expression right) implements Expression {
        public String label() { return "Op(" + operator.constantPattern() + ")"; }
        public List<Expression> children() { return List.of(left, right); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitBinary(this, context); }
    }

    public record IfExpression(NodeId id, Expression condition, Expression thenBranch, Expression elseBranch) implements Expression {
        public String label() { return "If"; }
        public List<Expression> children() { return List.of(condition, thenBranch, elseBranch); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitIf(this, context); }
    }

    public record FunctionExpression(NodeId id, String parameter, Expression body) implements Expression {
        public String label() { return "Fun(" + parameter + ")"; }
        public List<Expression> children() { return List.of(body); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitFunction(this, context); }
    }

    /** Monomorphic binding: the value's type is shared by every use of {@code name}. */
    public record LetExpression(NodeId id, String name, Expression value, Expression body) implements Expression {
        public String label() { return "Let(" + name + ")"; }
        public List<Expression> children() { return List.of(value, body); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitLet(this, context); }
    }

    public record ApplicationExpression(NodeId id, Expression function, Expression argument) implements Expression {
        public String label() { return "App"; }
        public List<Expression> children() { return List.of(function, argument); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitApplication(this, context); }
    }

    public record EmptyListExpression(NodeId id) implements Expression {
        public String label() { return "[]"; }
        public List<Expression> children() { return List.of(); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitEmptyList(this, context); }
    }

    public record ConsExpression(NodeId id, Expression head, Expression tail) implements Expression {
        public String label() { return "List"; }
        public List<Expression> children() { return List.of(head, tail); }
        public <C, R> R accept(Visitor<C, R> visitor, C context) { return visitor.visitCons(this, context); }
    }

    /** All nodes, parents before children. */
    public List<Expression> nodes() {
        List<Expression> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(Expression e, List<Expression> into) {
        into.add(e);
        e.children().forEach(c -> collect(c, into));
    }

    public Optional<Expression> find(NodeId id) {
        return nodes().stream().filter(e -> e.id().equals(id)).findFirst();
    }

    public String show() {
        return show(root);
    }

    /** Label followed by the children in brackets, e.g. {@code App[Var(f), Int(1)]}. */
    public static String show(Expression e) {
        var children = e.children();
        if (children.isEmpty()) {
            return e.label();
        }
        return e.label() + children.stream().map(SyntaxTree::show).collect(Collectors.joining(", ", "[", "]"));
    }

}
