/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ksc.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.ksc.ast.ParseAttempt.Rule;
import exm.ksc.ast.Token.Kind;
import exm.ksc.ast.tree.Declarations.ArrayDeclaration;
import exm.ksc.ast.tree.Declarations.Define;
import exm.ksc.ast.tree.Declarations.EnumDecl;
import exm.ksc.ast.tree.Declarations.FunctionDecl;
import exm.ksc.ast.tree.Declarations.Include;
import exm.ksc.ast.tree.Declarations.Param;
import exm.ksc.ast.tree.Declarations.StructDecl;
import exm.ksc.ast.tree.Declarations.Typedef;
import exm.ksc.ast.tree.Declarations.UnionDecl;
import exm.ksc.ast.tree.Declarations.VariableDecl;
import exm.ksc.ast.tree.Expressions.ArrayAccess;
import exm.ksc.ast.tree.Expressions.Assignment;
import exm.ksc.ast.tree.Expressions.BinaryOp;
import exm.ksc.ast.tree.Expressions.Call;
import exm.ksc.ast.tree.Expressions.MemberAccess;
import exm.ksc.ast.tree.Expressions.SizeOf;
import exm.ksc.ast.tree.Expressions.Ternary;
import exm.ksc.ast.tree.Expressions.UnaryOp;
import exm.ksc.ast.tree.Expressions.Variable;
import exm.ksc.ast.tree.Literals.BoolLiteral;
import exm.ksc.ast.tree.Literals.CharLiteral;
import exm.ksc.ast.tree.Literals.NullLiteral;
import exm.ksc.ast.tree.Literals.NumberLiteral;
import exm.ksc.ast.tree.Literals.StringLiteral;
import exm.ksc.ast.tree.Program;
import exm.ksc.ast.tree.Statements.Block;
import exm.ksc.ast.tree.Statements.Break;
import exm.ksc.ast.tree.Statements.Continue;
import exm.ksc.ast.tree.Statements.DoWhile;
import exm.ksc.ast.tree.Statements.ExpressionStatement;
import exm.ksc.ast.tree.Statements.For;
import exm.ksc.ast.tree.Statements.If;
import exm.ksc.ast.tree.Statements.Return;
import exm.ksc.ast.tree.Statements.While;
import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.InvalidSyntaxException;

/**
 * Recursive descent parser producing a {@link Program} from a token list.
 *
 * Grammar rules signal failure with {@link InvalidSyntaxException} and
 * never recover themselves.  Where several alternatives are possible the
 * parser tries each one with {@link #attempt(Rule)}, which restores the
 * cursor when the alternative fails.  The top level loop is the only
 * place errors are recovered from: the offending token is discarded and
 * parsing resumes.
 */
public class KernelParser {

  private static final Logger logger = Logging.getKSCLogger();

  private static final ImmutableSet<String> ASSIGN_OPS = ImmutableSet.of(
      "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=");

  /**
   * Binary operators by precedence level, lowest first.  All are left
   * associative.
   */
  private static final ImmutableList<ImmutableSet<String>> BINARY_LEVELS =
      ImmutableList.of(
          ImmutableSet.of("||"),
          ImmutableSet.of("&&"),
          ImmutableSet.of("|"),
          ImmutableSet.of("^"),
          ImmutableSet.of("&"),
          ImmutableSet.of("==", "!="),
          ImmutableSet.of("<", ">", "<=", ">="),
          ImmutableSet.of("<<", ">>"),
          ImmutableSet.of("+", "-"),
          ImmutableSet.of("*", "/", "%"));

  private static final ImmutableSet<String> UNARY_OPS = ImmutableSet.of(
      "+", "-", "!", "~", "++", "--", "*", "&");

  private static final ImmutableSet<String> BASE_TYPES = ImmutableSet.of(
      "void", "char", "short", "int", "long", "float", "double", "bool");

  private static final ImmutableSet<String> MODIFIERS = ImmutableSet.of(
      "const", "static", "extern", "register", "volatile");

  private final List<Token> tokens;
  private final Token eofToken;
  private int pos = 0;
  private boolean debug = false;

  /** True while parsing a function body */
  private boolean insideFunction = false;

  private final List<InvalidSyntaxException> recoveredErrors =
                          new ArrayList<InvalidSyntaxException>();

  public KernelParser(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
    if (tokens.isEmpty()) {
      this.eofToken = Token.eof(1, 1);
    } else {
      Token last = tokens.get(tokens.size() - 1);
      this.eofToken = Token.eof(last.line(),
                                last.column() + last.text().length());
    }
  }

  /**
   * Print each recovered syntax error to stderr
   */
  public void setDebug(boolean debug) {
    this.debug = debug;
  }

  /**
   * Parse the whole token list.  Never fails: declarations that do not
   * parse are skipped and recorded in {@link #getRecoveredErrors()}.
   */
  public Program parse() {
    pos = 0;
    insideFunction = false;
    recoveredErrors.clear();
    List<KernelAST> declarations = new ArrayList<KernelAST>();

    Rule<KernelAST> topLevel = new Rule<KernelAST>() {
      @Override
      public KernelAST parse() throws InvalidSyntaxException {
        return topLevelDeclaration();
      }
    };

    while (!atEnd()) {
      int start = pos;
      ParseAttempt<KernelAST> decl = attempt(topLevel);
      if (decl.isSuccess()) {
        if (decl.get() != null) {
          declarations.add(decl.get());
        }
      } else {
        recover(decl.getError());
        pos = start;
        consume();
      }
    }
    return new Program(declarations);
  }

  /**
   * @return errors skipped over by the last call to parse(), in order
   */
  public List<InvalidSyntaxException> getRecoveredErrors() {
    return ImmutableList.copyOf(recoveredErrors);
  }

  private void recover(InvalidSyntaxException e) {
    recoveredErrors.add(e);
    logger.debug("Skipping token after syntax error: " + e.getMessage());
    if (debug) {
      System.err.println("ParseError: " + e.getMessage());
    }
  }

  /**
   * Apply a rule, restoring the cursor if it fails
   */
  private <T> ParseAttempt<T> attempt(Rule<T> rule) {
    int saved = pos;
    try {
      return ParseAttempt.success(rule.parse());
    } catch (InvalidSyntaxException e) {
      pos = saved;
      return ParseAttempt.failure(e);
    }
  }

  /**
   * Check whether a rule would match here without consuming anything
   */
  private boolean lookahead(Rule<?> rule) {
    int saved = pos;
    try {
      rule.parse();
      return true;
    } catch (InvalidSyntaxException e) {
      return false;
    } finally {
      pos = saved;
    }
  }

  /*
   * Token access
   */

  private Token peek() {
    return peek(0);
  }

  private Token peek(int n) {
    if (pos + n < tokens.size()) {
      return tokens.get(pos + n);
    }
    return eofToken;
  }

  private boolean atEnd() {
    return pos >= tokens.size();
  }

  private Token consume() {
    Token t = peek();
    if (!t.is(Kind.EOF)) {
      pos++;
    }
    return t;
  }

  private boolean checkOp(String op) {
    return peek().is(Kind.OPERATOR, op);
  }

  private boolean checkKeyword(String keyword) {
    return peek().is(Kind.KEYWORD, keyword);
  }

  private Token expect(Kind kind, String what) throws InvalidSyntaxException {
    Token t = peek();
    if (!t.is(kind)) {
      throw unexpected(t, what);
    }
    return consume();
  }

  private Token expectOp(String op) throws InvalidSyntaxException {
    Token t = peek();
    if (!t.is(Kind.OPERATOR, op)) {
      throw unexpected(t, "'" + op + "'");
    }
    return consume();
  }

  private Token expectKeyword(String keyword) throws InvalidSyntaxException {
    Token t = peek();
    if (!t.is(Kind.KEYWORD, keyword)) {
      throw unexpected(t, "'" + keyword + "'");
    }
    return consume();
  }

  private InvalidSyntaxException unexpected(Token t, String expected) {
    if (t.is(Kind.EOF)) {
      return new InvalidSyntaxException(t.line(), t.column(),
          "Unexpected end of input, expected " + expected, true);
    }
    return new InvalidSyntaxException(t.line(), t.column(),
        "Expected " + expected + " but found " + describe(t));
  }

  private static String describe(Token t) {
    return t.kind().toString().toLowerCase() + " '" + t.text() + "'";
  }

  /*
   * Top level
   */

  private KernelAST topLevelDeclaration() throws InvalidSyntaxException {
    Token t = peek();
    if (t.is(Kind.PREPROC)) {
      return preprocessor();
    }

    InvalidSyntaxException failure = null;
    if (t.is(Kind.KEYWORD)) {
      Rule<KernelAST> typeDecl = typeDeclarationRule(t.stringValue());
      if (typeDecl != null) {
        ParseAttempt<KernelAST> a = attempt(typeDecl);
        if (a.isSuccess()) {
          return a.get();
        }
        failure = a.getError();
      }
    }

    ParseAttempt<KernelAST> func = attempt(new Rule<KernelAST>() {
      @Override
      public KernelAST parse() throws InvalidSyntaxException {
        return functionDeclaration();
      }
    });
    if (func.isSuccess()) {
      return func.get();
    }
    failure = ParseAttempt.furthest(failure, func.getError());

    ParseAttempt<KernelAST> var = attempt(declarationRule(true));
    if (var.isSuccess()) {
      return var.get();
    }
    failure = ParseAttempt.furthest(failure, var.getError());

    ParseAttempt<KernelAST> expr = attempt(expressionStatementRule());
    if (expr.isSuccess()) {
      return expr.get();
    }
    throw ParseAttempt.furthest(failure, expr.getError());
  }

  /**
   * @return rule for struct, union, enum or typedef, or null if the
   *         keyword does not start one
   */
  private Rule<KernelAST> typeDeclarationRule(String keyword) {
    if (keyword.equals("struct") || keyword.equals("union")) {
      return new Rule<KernelAST>() {
        @Override
        public KernelAST parse() throws InvalidSyntaxException {
          return aggregateDeclaration();
        }
      };
    } else if (keyword.equals("enum")) {
      return new Rule<KernelAST>() {
        @Override
        public KernelAST parse() throws InvalidSyntaxException {
          return enumDeclaration();
        }
      };
    } else if (keyword.equals("typedef")) {
      return new Rule<KernelAST>() {
        @Override
        public KernelAST parse() throws InvalidSyntaxException {
          return typedef();
        }
      };
    }
    return null;
  }

  /**
   * @return Include or Define node, or null for a skipped directive
   */
  private KernelAST preprocessor() throws InvalidSyntaxException {
    Token directive = consume();
    String word = directive.stringValue();
    if (word.equals("#include")) {
      if (checkOp("<")) {
        consume();
        StringBuilder filename = new StringBuilder();
        while (!checkOp(">")) {
          Token t = peek();
          if (t.is(Kind.EOF)) {
            throw unexpected(t, "'>'");
          }
          filename.append(consume().text());
        }
        consume();
        return new Include(directive.line(), directive.column(),
                           filename.toString(), true);
      }
      Token file = expect(Kind.STRING, "include file name");
      return new Include(directive.line(), directive.column(),
                         file.stringValue(), false);
    } else if (word.equals("#define")) {
      Token name = expect(Kind.ID, "macro name");
      KernelAST value = null;
      if (!peek().is(Kind.EOF) && peek().line() == name.line()) {
        value = expression();
      }
      return new Define(directive.line(), directive.column(),
                        name.stringValue(), value);
    }

    logger.trace("Skipping directive " + word + " on line " +
                 directive.line());
    while (!peek().is(Kind.EOF) && peek().line() == directive.line()) {
      consume();
    }
    return null;
  }

  /*
   * Declarations
   */

  private List<String> modifiers() {
    List<String> result = new ArrayList<String>();
    while (peek().is(Kind.KEYWORD) &&
           MODIFIERS.contains(peek().stringValue())) {
      result.add(consume().stringValue());
    }
    return result;
  }

  /**
   * Optional signedness, a base type keyword or identifier, then any
   * number of '*'
   */
  TypeSpec typeSpecifier() throws InvalidSyntaxException {
    String signedness = null;
    if (checkKeyword("signed") || checkKeyword("unsigned")) {
      signedness = consume().stringValue();
    }

    List<String> words = new ArrayList<String>();
    Token t = peek();
    if (t.is(Kind.KEYWORD) && BASE_TYPES.contains(t.stringValue())) {
      String base = consume().stringValue();
      words.add(base);
      if (base.equals("short") || base.equals("long")) {
        // short int, long long, long long int, ...
        while (words.size() < 3 &&
               (checkKeyword("int") || checkKeyword("long"))) {
          String w = consume().stringValue();
          words.add(w);
          if (w.equals("int")) {
            break;
          }
        }
      }
    } else if (t.is(Kind.ID)) {
      words.add(consume().stringValue());
    } else {
      throw unexpected(t, "type");
    }

    int pointers = 0;
    while (checkOp("*")) {
      consume();
      pointers++;
    }
    return new TypeSpec(signedness, words, pointers, 0);
  }

  private FunctionDecl functionDeclaration() throws InvalidSyntaxException {
    Token start = peek();
    List<String> modifiers = modifiers();
    TypeSpec returnType = typeSpecifier();
    Token name = expect(Kind.ID, "function name");
    expectOp("(");
    List<Param> params = parameterList();

    Block body = null;
    if (checkOp("{")) {
      boolean outer = insideFunction;
      insideFunction = true;
      try {
        body = block();
      } finally {
        insideFunction = outer;
      }
    } else {
      expectOp(";");
    }
    return new FunctionDecl(start.line(), start.column(), returnType,
                            name.stringValue(), params, body, modifiers);
  }

  /**
   * Parameters after the opening parenthesis, up to and including the
   * closing one.  Both () and (void) give no parameters.
   */
  private List<Param> parameterList() throws InvalidSyntaxException {
    List<Param> params = new ArrayList<Param>();
    if (checkOp(")")) {
      consume();
      return params;
    }
    if (checkKeyword("void") && peek(1).is(Kind.OPERATOR, ")")) {
      consume();
      consume();
      return params;
    }

    while (true) {
      Token start = peek();
      TypeSpec type = typeSpecifier();
      String name = null;
      if (peek().is(Kind.ID)) {
        name = consume().stringValue();
      }
      params.add(new Param(start.line(), start.column(), type, name));
      if (checkOp(",")) {
        consume();
      } else {
        break;
      }
    }
    expectOp(")");
    return params;
  }

  private Rule<KernelAST> declarationRule(final boolean requireSemicolon) {
    return new Rule<KernelAST>() {
      @Override
      public KernelAST parse() throws InvalidSyntaxException {
        return declaration(requireSemicolon);
      }
    };
  }

  /**
   * Variable or array declaration
   * @param requireSemicolon false if the caller consumes the terminator
   */
  private KernelAST declaration(boolean requireSemicolon)
      throws InvalidSyntaxException {
    Token start = peek();
    List<String> modifiers = modifiers();
    TypeSpec type = typeSpecifier();
    String name = expect(Kind.ID, "variable name").stringValue();

    if (checkOp("[")) {
      return arrayDeclaration(start, modifiers, type, name, requireSemicolon);
    }

    KernelAST value = null;
    if (checkOp("=")) {
      consume();
      value = expression();
    }
    if (requireSemicolon) {
      expectOp(";");
    }
    return new VariableDecl(start.line(), start.column(), type, name, value,
                            modifiers);
  }

  private ArrayDeclaration arrayDeclaration(Token start,
      List<String> modifiers, TypeSpec type, String name,
      boolean requireSemicolon) throws InvalidSyntaxException {
    expectOp("[");
    KernelAST size = null;
    if (!checkOp("]")) {
      size = expression();
    }
    expectOp("]");

    List<KernelAST> initializers = null;
    if (checkOp("=")) {
      consume();
      initializers = initializerList();
    }
    if (requireSemicolon) {
      expectOp(";");
    }
    return new ArrayDeclaration(start.line(), start.column(), type, name,
                                size, initializers, modifiers);
  }

  /**
   * { expr, expr, ... } with optional trailing comma
   */
  private List<KernelAST> initializerList() throws InvalidSyntaxException {
    expectOp("{");
    List<KernelAST> values = new ArrayList<KernelAST>();
    while (!checkOp("}")) {
      values.add(expression());
      if (checkOp(",")) {
        consume();
      } else {
        break;
      }
    }
    expectOp("}");
    return values;
  }

  private KernelAST aggregateDeclaration() throws InvalidSyntaxException {
    Token start = consume();
    boolean union = start.stringValue().equals("union");
    String name = "";
    if (peek().is(Kind.ID)) {
      name = consume().stringValue();
    }

    List<KernelAST> fields = new ArrayList<KernelAST>();
    if (checkOp("{")) {
      consume();
      while (!checkOp("}")) {
        fields.add(field());
      }
      expectOp("}");
    }
    expectOp(";");

    if (union) {
      return new UnionDecl(start.line(), start.column(), name, fields);
    }
    return new StructDecl(start.line(), start.column(), name, fields);
  }

  private KernelAST field() throws InvalidSyntaxException {
    Token start = peek();
    List<String> modifiers = modifiers();
    TypeSpec type = typeSpecifier();
    String name = expect(Kind.ID, "field name").stringValue();
    if (checkOp("[")) {
      consume();
      KernelAST size = null;
      if (!checkOp("]")) {
        size = expression();
      }
      expectOp("]");
      expectOp(";");
      return new ArrayDeclaration(start.line(), start.column(), type, name,
                                  size, null, modifiers);
    }
    expectOp(";");
    return new VariableDecl(start.line(), start.column(), type, name, null,
                            modifiers);
  }

  private EnumDecl enumDeclaration() throws InvalidSyntaxException {
    Token start = expectKeyword("enum");
    String name = "";
    if (peek().is(Kind.ID)) {
      name = consume().stringValue();
    }

    Map<String, Number> values = new LinkedHashMap<String, Number>();
    Map<String, KernelAST> initializers =
                                    new LinkedHashMap<String, KernelAST>();
    if (checkOp("{")) {
      consume();
      Number next = Long.valueOf(0);
      while (!checkOp("}")) {
        String enumerator = expect(Kind.ID, "enumerator").stringValue();
        if (checkOp("=")) {
          consume();
          KernelAST init = expression();
          initializers.put(enumerator, init);
          // Only literal initializers are evaluated
          if (init instanceof NumberLiteral) {
            next = ((NumberLiteral)init).getValue();
          }
        }
        values.put(enumerator, next);
        next = successor(next);
        if (checkOp(",")) {
          consume();
        } else {
          break;
        }
      }
      expectOp("}");
    }
    expectOp(";");
    return new EnumDecl(start.line(), start.column(), name, values,
                        initializers);
  }

  /**
   * Next auto-increment enumerator value, keeping the numeric kind
   */
  private static Number successor(Number value) {
    if (value instanceof Double) {
      return value.doubleValue() + 1;
    } else if (value instanceof BigInteger) {
      return ((BigInteger)value).add(BigInteger.ONE);
    } else if (value.longValue() == Long.MAX_VALUE) {
      return BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
    }
    return value.longValue() + 1;
  }

  /**
   * typedef base alias[, alias...];  Only the first alias is kept, with
   * its own pointer and array suffixes applied to the base type.
   */
  private Typedef typedef() throws InvalidSyntaxException {
    Token start = expectKeyword("typedef");
    TypeSpec base = typeSpecifier();

    TypeSpec firstType = null;
    String firstAlias = null;
    while (true) {
      int pointers = 0;
      while (checkOp("*")) {
        consume();
        pointers++;
      }
      String alias = expect(Kind.ID, "type alias").stringValue();
      int dims = 0;
      while (checkOp("[")) {
        consume();
        if (!checkOp("]")) {
          expression();
        }
        expectOp("]");
        dims++;
      }

      if (firstAlias == null) {
        firstAlias = alias;
        firstType = base.derive(pointers, dims);
      } else {
        logger.debug("typedef " + firstAlias + ": ignoring extra alias " +
                     alias);
      }

      if (checkOp(",")) {
        consume();
      } else {
        break;
      }
    }
    expectOp(";");
    return new Typedef(start.line(), start.column(), firstType, firstAlias);
  }

  /*
   * Statements
   */

  private Block block() throws InvalidSyntaxException {
    Token open = expectOp("{");
    List<KernelAST> statements = new ArrayList<KernelAST>();
    while (!checkOp("}")) {
      if (peek().is(Kind.EOF)) {
        throw unexpected(peek(), "'}' to close block opened on line " +
                                 open.line());
      }
      statements.add(statement());
    }
    consume();
    return new Block(open.line(), open.column(), statements);
  }

  private KernelAST statement() throws InvalidSyntaxException {
    Token t = peek();
    if (t.is(Kind.EOF)) {
      throw unexpected(t, "statement");
    }
    if (t.is(Kind.OPERATOR, ";")) {
      consume();
      return new ExpressionStatement(t.line(), t.column(), null);
    }
    if (t.is(Kind.OPERATOR, "{")) {
      return block();
    }

    if (t.is(Kind.KEYWORD)) {
      String keyword = t.stringValue();
      Rule<KernelAST> typeDecl = typeDeclarationRule(keyword);
      if (typeDecl != null) {
        return typeDecl.parse();
      } else if (keyword.equals("return")) {
        return returnStatement();
      } else if (keyword.equals("if")) {
        return ifStatement();
      } else if (keyword.equals("while")) {
        return whileStatement();
      } else if (keyword.equals("for")) {
        return forStatement();
      } else if (keyword.equals("do")) {
        return doWhileStatement();
      } else if (keyword.equals("break")) {
        consume();
        expectOp(";");
        return new Break(t.line(), t.column());
      } else if (keyword.equals("continue")) {
        consume();
        expectOp(";");
        return new Continue(t.line(), t.column());
      }
    }

    ParseAttempt<KernelAST> decl = attempt(declarationRule(true));
    if (decl.isSuccess()) {
      return decl.get();
    }
    ParseAttempt<KernelAST> expr = attempt(expressionStatementRule());
    if (expr.isSuccess()) {
      return expr.get();
    }

    if (insideFunction && lookahead(functionHeaderRule())) {
      throw new InvalidSyntaxException(t.line(), t.column(),
          "Function definitions are only allowed at top level");
    }
    throw ParseAttempt.furthest(decl.getError(), expr.getError());
  }

  /**
   * Matches the start of a function declaration: type, name, '('
   */
  private Rule<Object> functionHeaderRule() {
    return new Rule<Object>() {
      @Override
      public Object parse() throws InvalidSyntaxException {
        modifiers();
        typeSpecifier();
        expect(Kind.ID, "function name");
        return expectOp("(");
      }
    };
  }

  private Rule<KernelAST> expressionStatementRule() {
    return new Rule<KernelAST>() {
      @Override
      public KernelAST parse() throws InvalidSyntaxException {
        Token start = peek();
        KernelAST expr = expression();
        expectOp(";");
        return new ExpressionStatement(start.line(), start.column(), expr);
      }
    };
  }

  private Return returnStatement() throws InvalidSyntaxException {
    Token start = expectKeyword("return");
    KernelAST value = null;
    if (!checkOp(";")) {
      value = expression();
    }
    expectOp(";");
    return new Return(start.line(), start.column(), value);
  }

  private If ifStatement() throws InvalidSyntaxException {
    Token start = expectKeyword("if");
    expectOp("(");
    KernelAST condition = expression();
    expectOp(")");
    KernelAST thenStmt = statement();
    KernelAST elseStmt = null;
    if (checkKeyword("else")) {
      consume();
      elseStmt = statement();
    }
    return new If(start.line(), start.column(), condition, thenStmt,
                  elseStmt);
  }

  private While whileStatement() throws InvalidSyntaxException {
    Token start = expectKeyword("while");
    expectOp("(");
    KernelAST condition = expression();
    expectOp(")");
    KernelAST body = statement();
    return new While(start.line(), start.column(), condition, body);
  }

  private For forStatement() throws InvalidSyntaxException {
    Token start = expectKeyword("for");
    expectOp("(");

    KernelAST init = null;
    if (!checkOp(";")) {
      int initStart = pos;
      ParseAttempt<KernelAST> decl = attempt(declarationRule(false));
      if (decl.isSuccess() && checkOp(";")) {
        init = decl.get();
      } else {
        pos = initStart;
        init = expression();
      }
    }
    expectOp(";");

    KernelAST condition = null;
    if (!checkOp(";")) {
      condition = expression();
    }
    expectOp(";");

    KernelAST increment = null;
    if (!checkOp(")")) {
      increment = expression();
    }
    expectOp(")");

    KernelAST body = statement();
    return new For(start.line(), start.column(), init, condition, increment,
                   body);
  }

  private DoWhile doWhileStatement() throws InvalidSyntaxException {
    Token start = expectKeyword("do");
    KernelAST body = statement();
    expectKeyword("while");
    expectOp("(");
    KernelAST condition = expression();
    expectOp(")");
    expectOp(";");
    return new DoWhile(start.line(), start.column(), body, condition);
  }

  /*
   * Expressions
   */

  KernelAST expression() throws InvalidSyntaxException {
    return assignment();
  }

  private KernelAST assignment() throws InvalidSyntaxException {
    KernelAST left = ternary();
    Token t = peek();
    if (t.is(Kind.OPERATOR) && ASSIGN_OPS.contains(t.stringValue())) {
      consume();
      KernelAST right = assignment();
      return new Assignment(left.getLine(), left.getColumn(), left,
                            t.stringValue(), right);
    }
    return left;
  }

  private KernelAST ternary() throws InvalidSyntaxException {
    KernelAST condition = binary(0);
    if (checkOp("?")) {
      consume();
      KernelAST trueExpr = expression();
      expectOp(":");
      KernelAST falseExpr = ternary();
      return new Ternary(condition.getLine(), condition.getColumn(),
                         condition, trueExpr, falseExpr);
    }
    return condition;
  }

  /**
   * Precedence climbing over {@link #BINARY_LEVELS}
   */
  private KernelAST binary(int level) throws InvalidSyntaxException {
    if (level >= BINARY_LEVELS.size()) {
      return unary();
    }
    ImmutableSet<String> ops = BINARY_LEVELS.get(level);
    KernelAST left = binary(level + 1);
    while (peek().is(Kind.OPERATOR) && ops.contains(peek().stringValue())) {
      String op = consume().stringValue();
      KernelAST right = binary(level + 1);
      left = new BinaryOp(left.getLine(), left.getColumn(), op, left, right);
    }
    return left;
  }

  private KernelAST unary() throws InvalidSyntaxException {
    final Token t = peek();
    if (t.is(Kind.OPERATOR) && UNARY_OPS.contains(t.stringValue())) {
      consume();
      KernelAST operand = unary();
      return new UnaryOp(t.line(), t.column(), t.stringValue(), operand,
                         false);
    }

    if (t.is(Kind.KEYWORD, "sizeof")) {
      consume();
      if (checkOp("(")) {
        ParseAttempt<TypeSpec> type = attempt(new Rule<TypeSpec>() {
          @Override
          public TypeSpec parse() throws InvalidSyntaxException {
            expectOp("(");
            TypeSpec result = typeSpecifier();
            expectOp(")");
            return result;
          }
        });
        if (type.isSuccess()) {
          return new SizeOf(t.line(), t.column(), type.get());
        }
      }
      return new SizeOf(t.line(), t.column(), unary());
    }
    return postfix();
  }

  private KernelAST postfix() throws InvalidSyntaxException {
    KernelAST expr = primary();
    while (true) {
      Token t = peek();
      if (t.is(Kind.OPERATOR, "[")) {
        consume();
        KernelAST index = expression();
        expectOp("]");
        expr = new ArrayAccess(expr.getLine(), expr.getColumn(), expr, index);
      } else if (t.is(Kind.OPERATOR, "(")) {
        consume();
        List<KernelAST> args = new ArrayList<KernelAST>();
        if (!checkOp(")")) {
          args.add(expression());
          while (checkOp(",")) {
            consume();
            args.add(expression());
          }
        }
        expectOp(")");
        expr = new Call(expr.getLine(), expr.getColumn(), expr, args);
      } else if (t.is(Kind.OPERATOR, ".") || t.is(Kind.OPERATOR, "->")) {
        consume();
        String member = expect(Kind.ID, "member name").stringValue();
        expr = new MemberAccess(expr.getLine(), expr.getColumn(), expr,
                                member, t.stringValue().equals("->"));
      } else if (t.is(Kind.OPERATOR, "++") || t.is(Kind.OPERATOR, "--")) {
        consume();
        expr = new UnaryOp(expr.getLine(), expr.getColumn(), t.stringValue(),
                           expr, true);
      } else {
        return expr;
      }
    }
  }

  private KernelAST primary() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.kind()) {
      case OPERATOR:
        if (t.stringValue().equals("(")) {
          consume();
          KernelAST expr = expression();
          expectOp(")");
          return expr;
        }
        break;
      case ID:
        consume();
        return new Variable(t.line(), t.column(), t.stringValue());
      case NUMBER:
        consume();
        return new NumberLiteral(t.line(), t.column(), t.numberValue());
      case STRING:
        consume();
        return new StringLiteral(t.line(), t.column(), t.stringValue());
      case CHAR:
        consume();
        return new CharLiteral(t.line(), t.column(), t.stringValue());
      case KEYWORD:
        String keyword = t.stringValue();
        if (keyword.equals("true") || keyword.equals("false")) {
          consume();
          return new BoolLiteral(t.line(), t.column(),
                                 keyword.equals("true"));
        } else if (keyword.equals("null")) {
          consume();
          return new NullLiteral(t.line(), t.column());
        }
        break;
      default:
        break;
    }
    throw unexpected(t, "expression");
  }
}
