package com.github.typetrace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class Tokenizer {

    List<Pattern> patterns = new ArrayList<>();

    private final boolean strict;

    {
        for (var tokenType : TokenType.values()) {
            if (tokenType.constantPattern != null && !tokenType.word) {
                patterns.add(new StaticPattern(tokenType.constantPattern, tokenType));
            }
        }

        patterns.add(new IdentifierPattern());
        patterns.add(new NumberPattern());

        // longest operator first so that "==" wins over "=" and "->" over "-"
        patterns.sort(Comparator.comparingInt(
            (Pattern p) -> p instanceof StaticPattern sp ? sp.pattern.length() : Integer.MIN_VALUE).reversed());
    }

    public Tokenizer() {
        this(false);
    }

    /**
     * @param strict if set, characters that start no token raise a {@link LexException}
     *               instead of being skipped
     */
    public Tokenizer(boolean strict) {
        this.strict = strict;
    }

    public Tokens tokenize(String programString) {
        List<Token> tokens = new ArrayList<>();

        int index = 0;
        while (index < programString.length()) {
            if (Character.isWhitespace(programString.charAt(index))) {
                index++;
                continue;
            }

            boolean gotMatch = false;
            for (var pattern : patterns) {
                var result = pattern.match(programString, index);
                if (result.isPresent()) {
                    tokens.add(result.get());
                    index = result.get().end();
                    gotMatch = true;
                    break;
                }
            }
            if (!gotMatch) {
                char c = programString.charAt(index);
                if (strict) {
                    throw new LexException(c, index);
                }
                log.debug("skipping unrecognized character '{}' at {}", c, index);
                index++;
            }
        }

        tokens.add(new Token(TokenType.EOF, "", index, index));

        return new Tokens(tokens);
    }

    interface Pattern {
        Optional<Token> match(String programString, int index);
    }

    static class StaticPattern implements Pattern {
        String pattern;
        TokenType tokenType;

        public StaticPattern(String pattern, TokenType tokenType) {
            this.pattern = pattern;
            this.tokenType = tokenType;
        }

        @Override
        public Optional<Token> match(String programString, int index) {
            if (programString.startsWith(pattern, index)) {
                return Optional.of(new Token(tokenType, pattern, index, index + pattern.length()));
            } else {
                return Optional.empty();
            }
        }
    }

    static class NumberPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (isDigit(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && isDigit(programString.charAt(index))) {
                    index++;
                }
                return Optional.of(new Token(TokenType.NUMBER, programString.substring(start, index), start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    static class IdentifierPattern implements Pattern {
        @Override
        public Optional<Token> match(String programString, int index) {
            if (isIdentifierStart(programString.charAt(index))) {
                int start = index;
                while (index < programString.length() && isIdentifierPart(programString.charAt(index))) {
                    index++;
                }
                var image = programString.substring(start, index);
                var type = TokenType.ofWord(image).orElse(TokenType.IDENTIFIER);
                return Optional.of(new Token(type, image, start, index));
            } else {
                return Optional.empty();
            }
        }
    }

    // ASCII only, Character.isDigit would accept other scripts
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    public record Token(TokenType type, String image, int start, int end) {
        public String describe() {
            return type == TokenType.EOF ? "end of input" : "'" + image + "'";
        }
    }

    public enum TokenType {
        LET("let", true),
        IN("in", true),
        IF("if", true),
        THEN("then", true),
        ELSE("else", true),
        FUN("fun", true),
        TRUE("true", true),
        FALSE("false", true),

        NUMBER,
        IDENTIFIER,

        ARROW("->"),

        EQUALS_EQUALS("=="), NOT_EQUALS("!="),
        LE("<="), GE(">="),
        LT("<"), GT(">"),
        PLUS("+"), MINUS("-"),
        STAR("*"), SLASH("/"),
        CONS("::"),
        EQUALS("="),

        LPAREN("("),
        RPAREN(")"),
        LBRACKET("["),
        RBRACKET("]"),
        COMMA(","),
        EOF;

        final String constantPattern;
        final boolean word;

        private TokenType() {
            this(null);
        }
        private TokenType(String constantPattern) {
            this(constantPattern, false);
        }
        private TokenType(String constantPattern, boolean word) {
            this.constantPattern = constantPattern;
            this.word = word;
        }

        public String constantPattern() {
            return constantPattern;
        }

        /** Keywords and boolean literals only ever match a whole identifier. */
        static Optional<TokenType> ofWord(String image) {
            return Arrays.stream(values())
                    .filter(t -> t.word && t.constantPattern.equals(image))
                    .findFirst();
        }

        public boolean isBinaryOperator() {
            return switch (this) {
                case EQUALS_EQUALS, NOT_EQUALS, LE, GE, LT, GT, PLUS, MINUS, STAR, SLASH, CONS -> true;
                default -> false;
            };
        }

        public boolean isArithmetic() {
            return switch (this) {
                case PLUS, MINUS, STAR, SLASH -> true;
                default -> false;
            };
        }

        public boolean startsAtom() {
            return switch (this) {
                case NUMBER, TRUE, FALSE, IDENTIFIER, LPAREN, LBRACKET -> true;
                default -> false;
            };
        }
    }

    public static class Tokens {
        final List<Token> tokens;
        int index;

        Tokens(List<Token> tokens) {
            this.tokens = tokens;
        }

        public List<Token> all() {
            return List.copyOf(tokens);
        }

        public Token next() {
            var token = tokens.get(index);
            if (token.type() != TokenType.EOF) {
                index++;
            }
            return token;
        }

        public Token peek() {
            return tokens.get(index);
        }

        public boolean matches(TokenType... types) {
            TokenType peekType = peek().type();
            for (var type : types) {
                if (peekType == type) {
                    return true;
                }
            }
            return false;
        }

        public Token peek(TokenType type) {
            var token = peek();
            if (token.type() != type) {
                throw new SyntaxException(describe(type), token);
            }
            return token;
        }

        public Token next(TokenType type) {
            peek(type);
            return next();
        }

        private static String describe(TokenType type) {
            return switch (type) {
                case EOF -> "end of input";
                case IDENTIFIER -> "an identifier";
                case NUMBER -> "a number";
                default -> "'" + type.constantPattern + "'";
            };
        }
    }

}
