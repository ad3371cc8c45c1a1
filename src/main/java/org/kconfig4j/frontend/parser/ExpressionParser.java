package org.kconfig4j.frontend.parser;

import org.kconfig4j.frontend.lexer.Token;
import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.expr.AndExpr;
import org.kconfig4j.model.expr.CompareExpr;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.NotExpr;
import org.kconfig4j.model.expr.OrExpr;
import org.kconfig4j.model.expr.Relation;

/**
 * Recursive descent parser for expressions:
 * <pre>
 *   expr:     and_expr ['||' expr]
 *   and_expr: factor ['&amp;&amp;' and_expr]
 *   factor:   symbol [relation symbol] | '!' factor | '(' expr ')'
 * </pre>
 * Operators are right-associative, so {@code A || B || C} becomes {@code A || (B || C)}.
 * No constant folding is done here; parsed expressions print back as written.
 */
class ExpressionParser {

    private final ParsingContext context;

    ExpressionParser(ParsingContext context) {
        this.context = context;
    }

    Expr parse(boolean transformM) {
        Expr and = parseAnd(transformM);
        if (context.match(TokenType.OR)) {
            return new OrExpr(and, parse(transformM));
        }
        return and;
    }

    private Expr parseAnd(boolean transformM) {
        Expr factor = parseFactor(transformM);
        if (context.match(TokenType.AND)) {
            return new AndExpr(factor, parseAnd(transformM));
        }
        return factor;
    }

    private Expr parseFactor(boolean transformM) {
        Token token = context.advance();
        if (token != null && token.is(TokenType.SYMBOL)) {
            Token next = context.peek();
            Relation relation = next == null ? null : relationOf(next.type());
            if (relation == null) {
                Symbol sym = token.symbol();
                // 'm' in a condition only counts when modules are enabled
                if (transformM && sym == context.getSymbols().lookupConstant("m")) {
                    return new AndExpr(sym.expr(), context.getKconfig().getModules().expr());
                }
                return sym.expr();
            }
            context.advance();
            return new CompareExpr(relation, token.symbol(), context.expectSymbol());
        }
        if (token != null && token.is(TokenType.NOT)) {
            return new NotExpr(parseFactor(transformM));
        }
        if (token != null && token.is(TokenType.OPEN_PAREN)) {
            Expr inner = parse(transformM);
            if (context.match(TokenType.CLOSE_PAREN)) {
                return inner;
            }
        }
        throw context.error("malformed expression");
    }

    private static Relation relationOf(TokenType type) {
        switch (type) {
            case EQUAL:
                return Relation.EQUAL;
            case UNEQUAL:
                return Relation.UNEQUAL;
            case LESS:
                return Relation.LESS;
            case LESS_EQUAL:
                return Relation.LESS_EQUAL;
            case GREATER:
                return Relation.GREATER;
            case GREATER_EQUAL:
                return Relation.GREATER_EQUAL;
            default:
                return null;
        }
    }
}
