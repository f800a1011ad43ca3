package com.trading.sdg.compiler.parser;

import java.util.ArrayList;
import java.util.List;

import com.trading.sdg.compiler.CompileErrorKind;
import com.trading.sdg.compiler.CompileException;
import com.trading.sdg.compiler.parser.Ast.BinaryOperator;
import com.trading.sdg.compiler.parser.Ast.CompareOperator;
import com.trading.sdg.compiler.parser.Ast.Expr;
import com.trading.sdg.compiler.parser.Ast.Stmt;
import com.trading.sdg.compiler.parser.Ast.UnaryOperator;

/**
 * Recursive-descent parser for the expression subset of Python that strategy
 * scripts are written in.
 * <p>
 * Precedence, loosest first: conditional expression, {@code or}, {@code and},
 * {@code not}, comparisons, {@code |}, {@code &}, {@code + -},
 * {@code * / %}, unary {@code - + ~}, {@code **}, then calls, attribute
 * access and subscripts.
 */
public final class Parser {

    private final List<Token> tokens;
    private int pos;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Ast.Module parse(String source) {
        return new Parser(new Lexer(source).tokenize()).module();
    }

    public Ast.Module module() {
        List<Stmt> body = new ArrayList<>();
        while (true) {
            while (at(TokenType.NEWLINE) || at(TokenType.SEMICOLON))
                pos++;
            if (at(TokenType.EOF))
                break;
            body.add(statement());
            if (!at(TokenType.NEWLINE) && !at(TokenType.SEMICOLON) && !at(TokenType.EOF))
                throw syntax("Expected end of statement but found '" + peek().text() + "'");
        }
        return new Ast.Module(body);
    }

    // ── Statements ──────────────────────────────────────────────────

    private Stmt statement() {
        Token first = peek();
        if (first.type().isDisallowedStatement())
            throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                    "Disallowed construct: '" + first.text() + "' is not supported in strategy scripts", first.line());

        Expr lhs = exprList();
        if (!at(TokenType.ASSIGN))
            return new Ast.ExprStmt(lhs, first.line());

        pos++;
        List<String> targets = new ArrayList<>();
        boolean tuple;
        if (lhs instanceof Ast.Name n) {
            targets.add(n.id());
            tuple = false;
        } else if (lhs instanceof Ast.TupleExpr t) {
            for (Expr e : t.elements()) {
                if (!(e instanceof Ast.Name n))
                    throw new CompileException(CompileErrorKind.SYNTAX_ERROR,
                            "Tuple targets must be simple names", first.line());
                targets.add(n.id());
            }
            tuple = true;
        } else {
            throw new CompileException(CompileErrorKind.SYNTAX_ERROR,
                    "Assignment target must be a name or a tuple of names", first.line());
        }
        Expr value = exprList();
        if (at(TokenType.ASSIGN))
            throw syntax("Chained assignment is not supported");
        return new Ast.Assign(targets, tuple, value, first.line());
    }

    // ── Expressions ─────────────────────────────────────────────────

    private Expr exprList() {
        int line = peek().line();
        Expr first = expr();
        if (!at(TokenType.COMMA))
            return first;
        List<Expr> elements = new ArrayList<>();
        elements.add(first);
        while (accept(TokenType.COMMA)) {
            if (atExpressionEnd())
                break;
            elements.add(expr());
        }
        return new Ast.TupleExpr(elements, line);
    }

    private boolean atExpressionEnd() {
        return switch (peek().type()) {
            case NEWLINE, SEMICOLON, EOF, ASSIGN, RPAREN, RBRACKET, RBRACE -> true;
            default -> false;
        };
    }

    public Expr expr() {
        if (at(TokenType.LAMBDA))
            throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                    "Disallowed construct: 'lambda' is not supported in strategy scripts", peek().line());
        int line = peek().line();
        Expr body = orExpr();
        if (accept(TokenType.IF)) {
            Expr test = orExpr();
            expect(TokenType.ELSE, "'else' in conditional expression");
            Expr orElse = expr();
            return new Ast.IfExp(test, body, orElse, line);
        }
        return body;
    }

    private Expr orExpr() {
        int line = peek().line();
        Expr first = andExpr();
        if (!at(TokenType.OR))
            return first;
        List<Expr> values = new ArrayList<>(List.of(first));
        while (accept(TokenType.OR))
            values.add(andExpr());
        return new Ast.BoolOp(false, values, line);
    }

    private Expr andExpr() {
        int line = peek().line();
        Expr first = notExpr();
        if (!at(TokenType.AND))
            return first;
        List<Expr> values = new ArrayList<>(List.of(first));
        while (accept(TokenType.AND))
            values.add(notExpr());
        return new Ast.BoolOp(true, values, line);
    }

    private Expr notExpr() {
        Token t = peek();
        if (accept(TokenType.NOT))
            return new Ast.UnaryOp(UnaryOperator.NOT, notExpr(), t.line());
        return comparison();
    }

    private Expr comparison() {
        int line = peek().line();
        Expr left = bitOr();
        List<CompareOperator> ops = new ArrayList<>();
        List<Expr> rights = new ArrayList<>();
        while (true) {
            CompareOperator op = switch (peek().type()) {
                case LT -> CompareOperator.LT;
                case GT -> CompareOperator.GT;
                case LTE -> CompareOperator.LTE;
                case GTE -> CompareOperator.GTE;
                case EQ -> CompareOperator.EQ;
                case NEQ -> CompareOperator.NEQ;
                case IN, IS -> throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                        "Disallowed construct: '" + peek().text() + "' comparisons are not supported", peek().line());
                default -> null;
            };
            if (op == null)
                break;
            pos++;
            ops.add(op);
            rights.add(bitOr());
        }
        return ops.isEmpty() ? left : new Ast.Compare(left, ops, rights, line);
    }

    private Expr bitOr() {
        Expr left = bitAnd();
        while (at(TokenType.PIPE)) {
            int line = next().line();
            left = new Ast.BinOp(left, BinaryOperator.BIT_OR, bitAnd(), line);
        }
        return left;
    }

    private Expr bitAnd() {
        Expr left = arith();
        while (at(TokenType.AMPERSAND)) {
            int line = next().line();
            left = new Ast.BinOp(left, BinaryOperator.BIT_AND, arith(), line);
        }
        return left;
    }

    private Expr arith() {
        Expr left = term();
        while (at(TokenType.PLUS) || at(TokenType.MINUS)) {
            Token t = next();
            BinaryOperator op = t.type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            left = new Ast.BinOp(left, op, term(), t.line());
        }
        return left;
    }

    private Expr term() {
        Expr left = factor();
        while (true) {
            BinaryOperator op = switch (peek().type()) {
                case STAR -> BinaryOperator.MUL;
                case SLASH -> BinaryOperator.DIV;
                case PERCENT -> BinaryOperator.MOD;
                default -> null;
            };
            if (op == null)
                return left;
            int line = next().line();
            left = new Ast.BinOp(left, op, factor(), line);
        }
    }

    private Expr factor() {
        Token t = peek();
        UnaryOperator op = switch (t.type()) {
            case MINUS -> UnaryOperator.NEG;
            case PLUS -> UnaryOperator.POS;
            case TILDE -> UnaryOperator.INVERT;
            default -> null;
        };
        if (op != null) {
            pos++;
            return new Ast.UnaryOp(op, factor(), t.line());
        }
        return power();
    }

    private Expr power() {
        Expr base = postfix();
        if (at(TokenType.DOUBLE_STAR)) {
            int line = next().line();
            return new Ast.BinOp(base, BinaryOperator.POW, factor(), line);
        }
        return base;
    }

    private Expr postfix() {
        Expr e = atom();
        while (true) {
            Token t = peek();
            if (accept(TokenType.LPAREN)) {
                e = callArguments(e, t.line());
            } else if (accept(TokenType.DOT)) {
                Token name = expect(TokenType.NAME, "attribute name after '.'");
                e = new Ast.Attribute(e, name.text(), t.line());
            } else if (accept(TokenType.LBRACKET)) {
                Expr index = expr();
                expect(TokenType.RBRACKET, "']'");
                e = new Ast.Subscript(e, index, t.line());
            } else {
                return e;
            }
        }
    }

    private Expr callArguments(Expr func, int line) {
        List<Expr> args = new ArrayList<>();
        List<Ast.Keyword> keywords = new ArrayList<>();
        while (!at(TokenType.RPAREN)) {
            if (at(TokenType.NAME) && peekAt(1).type() == TokenType.ASSIGN) {
                String name = next().text();
                pos++;
                for (Ast.Keyword k : keywords) {
                    if (k.name().equals(name))
                        throw syntax("Keyword argument '" + name + "' repeated");
                }
                keywords.add(new Ast.Keyword(name, expr()));
            } else {
                if (!keywords.isEmpty())
                    throw syntax("Positional argument follows keyword argument");
                args.add(expr());
            }
            if (!accept(TokenType.COMMA))
                break;
        }
        expect(TokenType.RPAREN, "')'");
        return new Ast.Call(func, args, keywords, line);
    }

    private Expr atom() {
        Token t = next();
        switch (t.type()) {
            case NAME:
                return new Ast.Name(t.text(), t.line());
            case INTEGER:
            case FLOAT:
                return new Ast.Constant(t.value(), t.line());
            case STRING: {
                StringBuilder sb = new StringBuilder((String) t.value());
                while (at(TokenType.STRING))
                    sb.append((String) next().value());
                return new Ast.Constant(sb.toString(), t.line());
            }
            case TRUE:
                return new Ast.Constant(Boolean.TRUE, t.line());
            case FALSE:
                return new Ast.Constant(Boolean.FALSE, t.line());
            case NONE:
                return new Ast.Constant(null, t.line());
            case LPAREN: {
                if (accept(TokenType.RPAREN))
                    return new Ast.TupleExpr(List.of(), t.line());
                Expr inner = exprList();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            case LBRACKET: {
                List<Expr> elements = new ArrayList<>();
                while (!at(TokenType.RBRACKET)) {
                    elements.add(expr());
                    if (!accept(TokenType.COMMA))
                        break;
                }
                expect(TokenType.RBRACKET, "']'");
                return new Ast.ListExpr(elements, t.line());
            }
            case LBRACE: {
                List<Expr> keys = new ArrayList<>();
                List<Expr> values = new ArrayList<>();
                while (!at(TokenType.RBRACE)) {
                    keys.add(expr());
                    expect(TokenType.COLON, "':' in dict literal");
                    values.add(expr());
                    if (!accept(TokenType.COMMA))
                        break;
                }
                expect(TokenType.RBRACE, "'}'");
                return new Ast.DictExpr(keys, values, t.line());
            }
            case LAMBDA:
                throw new CompileException(CompileErrorKind.DISALLOWED_CONSTRUCT,
                        "Disallowed construct: 'lambda' is not supported in strategy scripts", t.line());
            default:
                if (t.type() != TokenType.EOF)
                    pos--;
                throw syntax(t.type() == TokenType.EOF || t.type() == TokenType.NEWLINE
                        ? "Unexpected end of expression"
                        : "Unexpected token '" + t.text() + "'");
        }
    }

    // ── Token helpers ───────────────────────────────────────────────

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF)
            pos++;
        return t;
    }

    private boolean at(TokenType type) {
        return peek().type() == type;
    }

    private boolean accept(TokenType type) {
        if (at(type)) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String what) {
        if (!at(type))
            throw syntax("Expected " + what + " but found '" + peek().text() + "'");
        return next();
    }

    private CompileException syntax(String message) {
        return new CompileException(CompileErrorKind.SYNTAX_ERROR, message, peek().line());
    }
}
