package monoc.parser;

import monoc.ast.Program;
import monoc.ast.decl.Decl;
import monoc.ast.decl.FieldDecl;
import monoc.ast.decl.FunctionDecl;
import monoc.ast.decl.StructDecl;
import monoc.ast.expr.*;
import monoc.ast.pattern.BindingPattern;
import monoc.ast.pattern.LiteralPattern;
import monoc.ast.pattern.Pattern;
import monoc.ast.pattern.WildcardPattern;
import monoc.ast.stmt.*;
import monoc.ast.type.ArrayTypeRef;
import monoc.ast.type.GenericTypeRef;
import monoc.ast.type.NamedTypeRef;
import monoc.ast.type.PrimitiveTypeRef;
import monoc.ast.type.TypeArg;
import monoc.ast.type.TypeRef;
import monoc.lexer.Token;
import monoc.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<Decl> items = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (match(TokenType.FNC)) items.add(parseFunctionDecl());
            else if (match(TokenType.STRUCT)) items.add(parseStructDecl());
            else throw error(peek(), "Expected 'fnc' or 'struct' at top-level");
        }
        consume(TokenType.EOF, "Expected EOF");
        return new Program(items);
    }

    // ---------- function ----------
    // fnc name[N: int, Flag: bool] : ret(params) { ... }
    private FunctionDecl parseFunctionDecl() {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");

        List<FunctionDecl.CompileTimeParam> ctParams = List.of();
        if (match(TokenType.LBRACKET)) {
            ctParams = parseCompileTimeParams();
            consume(TokenType.RBRACKET, "Expected ']' after compile-time parameters");
        }

        TypeRef retType = null;
        if (match(TokenType.COLON)) retType = parseTypeRef();

        consume(TokenType.LPAREN, "Expected '(' before parameters");
        List<FunctionDecl.Param> params = parseParamsOpt();
        consume(TokenType.RPAREN, "Expected ')' after parameters");

        BlockStmt body = parseBlock();
        return new FunctionDecl(name.lexeme(), ctParams, params, retType, body);
    }

    private List<FunctionDecl.CompileTimeParam> parseCompileTimeParams() {
        List<FunctionDecl.CompileTimeParam> ps = new ArrayList<>();
        do {
            Token n = consume(TokenType.IDENTIFIER, "Expected compile-time parameter name");
            consume(TokenType.COLON, "Expected ':' after compile-time parameter name");
            FunctionDecl.CompileTimeParam.Kind kind;
            if (match(TokenType.INT)) kind = FunctionDecl.CompileTimeParam.Kind.INT;
            else if (match(TokenType.BOOL)) kind = FunctionDecl.CompileTimeParam.Kind.BOOL;
            else throw error(peek(), "Compile-time parameter must be 'int' or 'bool'");
            ps.add(new FunctionDecl.CompileTimeParam(n.lexeme(), kind));
        } while (match(TokenType.COMMA));
        return ps;
    }

    private List<FunctionDecl.Param> parseParamsOpt() {
        if (check(TokenType.RPAREN)) return List.of();
        List<FunctionDecl.Param> ps = new ArrayList<>();
        do {
            Token n = consume(TokenType.IDENTIFIER, "Expected parameter name");
            consume(TokenType.COLON, "Expected ':' after parameter name");
            TypeRef t = parseTypeRef();
            ps.add(new FunctionDecl.Param(n.lexeme(), t));
        } while (match(TokenType.COMMA));
        return ps;
    }

    // ---------- struct ----------
    private StructDecl parseStructDecl() {
        Token name = consume(TokenType.IDENTIFIER, "Expected struct name");
        consume(TokenType.LBRACE, "Expected '{' after struct name");

        List<FieldDecl> fields = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            Token fieldName = consume(TokenType.IDENTIFIER, "Expected field name");
            consume(TokenType.COLON, "Expected ':' after field name");
            TypeRef t = parseTypeRef();
            consume(TokenType.SEMICOLON, "Expected ';' after field declaration");
            fields.add(new FieldDecl(fieldName.lexeme(), t));
        }

        consume(TokenType.RBRACE, "Expected '}' after struct body");
        return new StructDecl(name.lexeme(), fields);
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            stmts.add(parseStmt());
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new BlockStmt(stmts);
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();

        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.WHILE)) return parseWhile();
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.RETURN)) return parseReturn();
        if (match(TokenType.DEFER)) return new DeferStmt(parseBlock());
        if (match(TokenType.WITH)) return parseWith();
        if (match(TokenType.MATCH)) return parseMatch();
        if (match(TokenType.BREAK)) {
            consume(TokenType.SEMICOLON, "Expected ';' after break");
            return new BreakStmt();
        }
        if (match(TokenType.CONTINUE)) {
            consume(TokenType.SEMICOLON, "Expected ';' after continue");
            return new ContinueStmt();
        }
        if (match(TokenType.LET, TokenType.VAR)) {
            VarDeclStmt v = parseLet(previous().type() == TokenType.VAR);
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
            return v;
        }

        // varDecl: IDENTIFIER ':' type ('=' expr)?
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.COLON)) {
            VarDeclStmt v = parseTypedVarDecl();
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
            return v;
        }

        Expr e = parseExpr();
        if (match(TokenType.ASSIGN)) {
            Token at = previous();
            if (!(e instanceof VarExpr
                    || e instanceof FieldAccessExpr
                    || e instanceof ArrayAccessExpr)) {
                throw error(at, "Invalid assignment target");
            }
            Expr value = parseExpr();
            consume(TokenType.SEMICOLON, "Expected ';' after assignment");
            return new AssignStmt(e, value);
        }
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExprStmt(e);
    }

    // let name (: type)? (= expr)?
    private VarDeclStmt parseLet(boolean mutable) {
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        TypeRef type = match(TokenType.COLON) ? parseTypeRef() : null;
        Expr init = match(TokenType.ASSIGN) ? parseExpr() : null;
        return new VarDeclStmt(name.lexeme(), mutable, type, init);
    }

    private VarDeclStmt parseTypedVarDecl() {
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        consume(TokenType.COLON, "Expected ':' after variable name");
        TypeRef type = parseTypeRef();

        Expr init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpr();
        }
        return new VarDeclStmt(name.lexeme(), true, type, init);
    }

    private IfStmt parseIf() {
        List<IfStmt.Branch> branches = new ArrayList<>();
        branches.add(parseBranch("if"));

        BlockStmt elseB = null;
        while (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                branches.add(parseBranch("else if"));
            } else {
                elseB = parseBlock();
                break;
            }
        }
        return new IfStmt(branches, elseB);
    }

    private IfStmt.Branch parseBranch(String what) {
        consume(TokenType.LPAREN, "Expected '(' after " + what);
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        return new IfStmt.Branch(cond, parseBlock());
    }

    private WhileStmt parseWhile() {
        consume(TokenType.LPAREN, "Expected '(' after while");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        BlockStmt body = parseBlock();
        return new WhileStmt(cond, body);
    }

    // for (x in iterable) { ... }
    private ForStmt parseFor() {
        consume(TokenType.LPAREN, "Expected '(' after for");
        Token var = consume(TokenType.IDENTIFIER, "Expected loop variable");
        consume(TokenType.IN, "Expected 'in'");
        Expr iterable = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        BlockStmt body = parseBlock();
        return new ForStmt(var.lexeme(), iterable, body);
    }

    // with (name = value) { ... }
    private WithStmt parseWith() {
        consume(TokenType.LPAREN, "Expected '(' after with");
        Token var = consume(TokenType.IDENTIFIER, "Expected resource name");
        consume(TokenType.ASSIGN, "Expected '=' after resource name");
        Expr value = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        return new WithStmt(var.lexeme(), value, parseBlock());
    }

    // match (e) { case pattern (if guard)? { ... } ... }
    private MatchStmt parseMatch() {
        consume(TokenType.LPAREN, "Expected '(' after match");
        Expr scrutinee = parseExpr();
        consume(TokenType.RPAREN, "Expected ')'");
        consume(TokenType.LBRACE, "Expected '{' after match subject");

        List<MatchStmt.Arm> arms = new ArrayList<>();
        while (match(TokenType.CASE)) {
            Pattern pattern = parsePattern();
            Expr guard = match(TokenType.IF) ? parseExpr() : null;
            arms.add(new MatchStmt.Arm(pattern, guard, parseBlock()));
        }
        consume(TokenType.RBRACE, "Expected '}' after match arms");
        return new MatchStmt(scrutinee, arms);
    }

    private Pattern parsePattern() {
        if (check(TokenType.IDENTIFIER)) {
            String name = advance().lexeme();
            return "_".equals(name) ? new WildcardPattern() : new BindingPattern(name);
        }
        Expr lit = parseLiteralArg();
        if (lit instanceof Literal l) return new LiteralPattern(l);
        throw error(previous(), "Expected pattern");
    }

    private ReturnStmt parseReturn() {
        if (check(TokenType.SEMICOLON)) {
            advance();
            return new ReturnStmt(null);
        }
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(value);
    }

    // ---------- types ----------
    private TypeRef parseTypeRef() {
        // base type: int/float/bool/string/void, Name or Name<args>
        TypeRef base;
        if (match(TokenType.INT)) base = new PrimitiveTypeRef("int");
        else if (match(TokenType.FLOAT)) base = new PrimitiveTypeRef("float");
        else if (match(TokenType.BOOL)) base = new PrimitiveTypeRef("bool");
        else if (match(TokenType.STRING)) base = new PrimitiveTypeRef("string");
        else if (match(TokenType.VOID)) base = new PrimitiveTypeRef("void");
        else {
            Token n = consume(TokenType.IDENTIFIER, "Expected type name");
            if (match(TokenType.LT)) {
                List<TypeArg> args = new ArrayList<>();
                do { args.add(parseTypeArg()); } while (match(TokenType.COMMA));
                consume(TokenType.GT, "Expected '>' after type arguments");
                base = new GenericTypeRef(n.lexeme(), args);
            } else {
                base = new NamedTypeRef(n.lexeme());
            }
        }

        // array suffix: [] or [size]
        while (match(TokenType.LBRACKET)) {
            Expr size = null;
            if (!check(TokenType.RBRACKET)) {
                size = parseExpr();
            }
            consume(TokenType.RBRACKET, "Expected ']'");
            base = new ArrayTypeRef(base, size);
        }
        return base;
    }

    // a literal or a parenthesised expression is a value; anything else is a type
    private TypeArg parseTypeArg() {
        if (check(TokenType.INT_LITERAL) || check(TokenType.BOOL_LITERAL) || check(TokenType.MINUS)) {
            return new TypeArg.OfValue(parseLiteralArg());
        }
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return new TypeArg.OfValue(e);
        }
        return new TypeArg.OfType(parseTypeRef());
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseRange(); }

    private Expr parseRange() {
        Expr from = parseTernary();
        if (match(TokenType.RANGE)) {
            return new RangeExpr(from, parseTernary());
        }
        return from;
    }

    private Expr parseTernary() {
        Expr cond = parseOr();
        if (match(TokenType.QUESTION)) {
            Expr thenE = parseTernary();
            consume(TokenType.COLON, "Expected ':' in conditional expression");
            Expr elseE = parseTernary();
            return new TernaryExpr(cond, thenE, elseE);
        }
        return cond;
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseCompare();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseAdd();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) {
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary());
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary());
        }
        if (match(TokenType.TRY)) {
            return new TryExpr(parseUnary());
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                e = new CallExpr(e, List.of(), parseArgsRest());
                continue;
            }
            if (match(TokenType.LBRACKET)) {
                e = parseBracketSuffix(e);
                continue;
            }
            if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expected field name after '.'");
                if (match(TokenType.LPAREN)) {
                    e = new MethodCallExpr(e, name.lexeme(), parseArgsRest());
                } else {
                    e = new FieldAccessExpr(e, name.lexeme());
                }
                continue;
            }
            break;
        }
        return e;
    }

    // after '(': args ')'
    private List<Expr> parseArgsRest() {
        List<Expr> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do { args.add(parseExpr()); } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expected ')'");
        return args;
    }

    // after '[': index a[i], slice a[s:e], or compile-time arguments f[1, T](...)
    private Expr parseBracketSuffix(Expr target) {
        if (match(TokenType.COLON)) {
            Expr end = check(TokenType.RBRACKET) ? null : parseExpr();
            consume(TokenType.RBRACKET, "Expected ']' after slice");
            return new SliceExpr(target, null, end);
        }

        Expr first = parseBracketItem();
        if (match(TokenType.COLON)) {
            Expr end = check(TokenType.RBRACKET) ? null : parseExpr();
            consume(TokenType.RBRACKET, "Expected ']' after slice");
            return new SliceExpr(target, first, end);
        }

        List<Expr> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) items.add(parseBracketItem());
        consume(TokenType.RBRACKET, "Expected ']'");

        if (match(TokenType.LPAREN)) {
            return new CallExpr(target, items, parseArgsRest());
        }
        if (items.size() > 1) throw error(peek(), "Expected '(' after compile-time arguments");
        return new ArrayAccessExpr(target, first);
    }

    // a lone negative integer is one literal, so f[-10] carries the value -10
    private Expr parseBracketItem() {
        if (check(TokenType.MINUS) && checkAt(1, TokenType.INT_LITERAL)
                && (checkAt(2, TokenType.RBRACKET) || checkAt(2, TokenType.COMMA))) {
            advance();
            return new IntLiteral(parseLong(advance(), true));
        }
        return parseExpr();
    }

    // literal with an optional leading '-' on integers
    private Expr parseLiteralArg() {
        if (match(TokenType.MINUS)) {
            return new IntLiteral(parseLong(consume(TokenType.INT_LITERAL, "Expected integer after '-'"), true));
        }
        Expr e = parsePrimary();
        if (!(e instanceof Literal)) throw error(previous(), "Expected literal");
        return e;
    }

    private Expr parseArrayLiteral() {
        consume(TokenType.LBRACKET, "Expected '['");
        List<Expr> elems = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            do {
                elems.add(parseExpr());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACKET, "Expected ']'");
        return new ArrayLiteralExpr(elems);
    }

    // new Name { field: expr, ... }
    private Expr parseStructLiteral() {
        Token name = consume(TokenType.IDENTIFIER, "Expected struct name after 'new'");
        consume(TokenType.LBRACE, "Expected '{' after struct name");
        List<StructLiteralExpr.FieldInit> fields = new ArrayList<>();
        if (!check(TokenType.RBRACE)) {
            do {
                Token f = consume(TokenType.IDENTIFIER, "Expected field name");
                consume(TokenType.COLON, "Expected ':' after field name");
                fields.add(new StructLiteralExpr.FieldInit(f.lexeme(), parseExpr()));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RBRACE, "Expected '}' after struct literal");
        return new StructLiteralExpr(name.lexeme(), fields);
    }

    private Expr parsePrimary() {
        if (check(TokenType.LBRACKET)) {
            return parseArrayLiteral();
        }
        if (match(TokenType.NEW)) return parseStructLiteral();
        if (match(TokenType.INT_LITERAL)) return new IntLiteral(parseLong(previous(), false));
        if (match(TokenType.FLOAT_LITERAL)) return new FloatLiteral(Double.parseDouble(previous().lexeme()));
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(previous().lexeme());
        if (match(TokenType.CHAR_LITERAL)) return new CharLiteral(previous().lexeme().charAt(0));
        if (match(TokenType.BOOL_LITERAL)) {
            String text = previous().lexeme();
            return new BoolLiteral("T".equals(text) || "true".equals(text));
        }
        if (match(TokenType.NONE)) return new NoneLiteral();
        if (match(TokenType.IDENTIFIER)) return new VarExpr(previous().lexeme());
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        throw error(peek(), "Expected expression");
    }

    private long parseLong(Token tok, boolean negate) {
        String text = tok.lexeme();
        int radix = 10;
        if (text.startsWith("0x") || text.startsWith("0X")) {
            text = text.substring(2);
            radix = 16;
        }
        try {
            return Long.parseLong(negate ? "-" + text : text, radix);
        } catch (NumberFormatException ex) {
            throw error(tok, "Integer literal out of range");
        }
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        return checkAt(1, t);
    }

    private boolean checkAt(int offset, TokenType t) {
        if (pos + offset >= tokens.size()) return false;
        return tokens.get(pos + offset).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private ParserException error(Token at, String msg) {
        return new ParserException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " '" + at.lexeme() + "')");
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }

}
