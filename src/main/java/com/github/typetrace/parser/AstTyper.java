package com.github.typetrace.parser;

import com.github.typetrace.UndefinedVariableException;
import com.github.typetrace.parser.SyntaxTree.ApplicationExpression;
import com.github.typetrace.parser.SyntaxTree.BinaryExpression;
import com.github.typetrace.parser.SyntaxTree.BooleanExpression;
import com.github.typetrace.parser.SyntaxTree.ConsExpression;
import com.github.typetrace.parser.SyntaxTree.EmptyListExpression;
import com.github.typetrace.parser.SyntaxTree.Expression;
import com.github.typetrace.parser.SyntaxTree.FunctionExpression;
import com.github.typetrace.parser.SyntaxTree.IfExpression;
import com.github.typetrace.parser.SyntaxTree.LetExpression;
import com.github.typetrace.parser.SyntaxTree.NumberExpression;
import com.github.typetrace.parser.SyntaxTree.VariableExpression;
import com.github.typetrace.parser.TraceEvent.Category;
import com.github.typetrace.parser.Type.Arrow;
import com.github.typetrace.parser.Type.ListType;

/**
 * Simplified Algorithm W: walks the tree once, solving every equality constraint on the spot
 * through the session's {@link Unifier}.
 * <p>
 * {@code let} does not generalize. The bound value's type, including any variables still
 * open in it, is shared by every use of the name in the body.
 */
public class AstTyper implements SyntaxTree.Visitor<Environment, Type> {

    private final TypeVariables typeVariables;
    private final Trace trace;
    private final Unifier unifier;

    public AstTyper(InferenceSession session) {
        this.typeVariables = session.typeVariables();
        this.trace = session.trace();
        this.unifier = session.unifier();
    }

    public Type typeExpression(Expression expression, Environment environment) {
        trace.emit("AST: analyzing " + expression.label(), Category.AST, expression.id());
        return expression.accept(this, environment);
    }

    @Override
    public Type visitNumber(NumberExpression e, Environment environment) {
        return Type.INT;
    }

    @Override
    public Type visitBoolean(BooleanExpression e, Environment environment) {
        return Type.BOOL;
    }

    @Override
    public Type visitVariable(VariableExpression e, Environment environment) {
        return environment.lookup(e.name())
                .orElseThrow(() -> new UndefinedVariableException(e.name()));
    }

    @Override
    public Type visitEmptyList(EmptyListExpression e, Environment environment) {
        return new ListType(typeVariables.fresh());
    }

    @Override
    public Type visitCons(ConsExpression e, Environment environment) {
        var head = typeExpression(e.head(), environment);
        var tail = typeExpression(e.tail(), environment);
        unifier.unify(tail, new ListType(head), "list must be homogeneous", e.id());
        return new ListType(head);
    }

    @Override
    public Type visitBinary(BinaryExpression e, Environment environment) {
        var left = typeExpression(e.left(), environment);
        var right = typeExpression(e.right(), environment);
        var operator = e.operator().constantPattern();
        trace.emit("CONSTRAINT: '" + operator + "' requires compatible operands", Category.INFO, e.id());

        if (e.operator().isArithmetic()) {
            unifier.unify(left, Type.INT, "left of '" + operator + "'", e.id());
            unifier.unify(right, Type.INT, "right of '" + operator + "'", e.id());
            return Type.INT;
        }
        unifier.unify(left, right, "operands of '" + operator + "'", e.id());
        return Type.BOOL;
    }

    @Override
    public Type visitIf(IfExpression e, Environment environment) {
        var condition = typeExpression(e.condition(), environment);
        unifier.unify(condition, Type.BOOL, "if condition", e.id());
        var thenType = typeExpression(e.thenBranch(), environment);
        var elseType = typeExpression(e.elseBranch(), environment);
        unifier.unify(thenType, elseType, "then/else branches", e.id());
        return typeVariables.prune(thenType);
    }

    @Override
    public Type visitFunction(FunctionExpression e, Environment environment) {
        var parameter = typeVariables.fresh();
        trace.emit("SCOPE: " + e.parameter() + " : " + parameter.name(), Category.WARN, e.id());
        var body = typeExpression(e.body(), environment.extend(e.parameter(), parameter));
        return new Arrow(parameter, body);
    }

    @Override
    public Type visitApplication(ApplicationExpression e, Environment environment) {
        var function = typeExpression(e.function(), environment);
        var argument = typeExpression(e.argument(), environment);
        var result = typeVariables.fresh();
        unifier.unify(function, new Arrow(argument, result), "function application", e.id());
        return result;
    }

    @Override
    public Type visitLet(LetExpression e, Environment environment) {
        var value = typeExpression(e.value(), environment);
        trace.emit("SCOPE: " + e.name() + " : " + typeVariables.show(value), Category.WARN, e.id());
        return typeExpression(e.body(), environment.extend(e.name(), value));
    }

}
