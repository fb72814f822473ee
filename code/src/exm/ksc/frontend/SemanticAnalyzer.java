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
package exm.ksc.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.ksc.ast.KernelAST;
import exm.ksc.ast.TypeSpec;
import exm.ksc.ast.tree.Declarations.AggregateDecl;
import exm.ksc.ast.tree.Declarations.ArrayDeclaration;
import exm.ksc.ast.tree.Declarations.Define;
import exm.ksc.ast.tree.Declarations.EnumDecl;
import exm.ksc.ast.tree.Declarations.FunctionDecl;
import exm.ksc.ast.tree.Declarations.Param;
import exm.ksc.ast.tree.Declarations.Typedef;
import exm.ksc.ast.tree.Declarations.VariableDecl;
import exm.ksc.ast.tree.Expressions.Assignment;
import exm.ksc.ast.tree.Expressions.BinaryOp;
import exm.ksc.ast.tree.Expressions.Call;
import exm.ksc.ast.tree.Expressions.SizeOf;
import exm.ksc.ast.tree.Expressions.Variable;
import exm.ksc.ast.tree.Literals.NumberLiteral;
import exm.ksc.ast.tree.Program;
import exm.ksc.ast.tree.Statements.Block;
import exm.ksc.ast.tree.Statements.For;
import exm.ksc.ast.tree.Statements.If;
import exm.ksc.ast.tree.Statements.While;
import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.CompileException;
import exm.ksc.common.exceptions.DoubleDefineException;
import exm.ksc.common.exceptions.InvalidWriteException;
import exm.ksc.common.exceptions.UndefinedTypeException;
import exm.ksc.common.exceptions.UndefinedVarError;
import exm.ksc.common.lang.Types;
import exm.ksc.common.lang.Types.ArrayType;
import exm.ksc.common.lang.Types.EnumType;
import exm.ksc.common.lang.Types.FunctionType;
import exm.ksc.common.lang.Types.StructType;
import exm.ksc.common.lang.Types.Type;

/**
 * Walks a parsed program checking declarations and name usage.
 *
 * Errors are collected rather than thrown so that one walk reports as
 * much as possible; {@link #analyze(Program)} throws the first one at
 * the end.  Warnings never stop analysis.
 */
public class SemanticAnalyzer {

  private final Logger logger = Logging.getKSCLogger();

  private final ScopeTree scopes = new ScopeTree();
  private final List<CompileException> errors =
                              new ArrayList<CompileException>();
  private final List<String> warnings = new ArrayList<String>();

  /** Symbol kind given to variable declarations being visited */
  private Symbol.Kind declKind = Symbol.Kind.VARIABLE;

  public SemanticAnalyzer() {
    Builtins.register(scopes);
  }

  /**
   * Check a whole program
   * @throws CompileException the first error found, after the whole
   *        program has been checked
   */
  public void analyze(Program program) throws CompileException {
    scopes.enterScope("program");
    for (KernelAST decl: program.getDeclarations()) {
      visit(decl);
    }
    scopes.leaveScope();

    reportUnused();

    if (logger.isDebugEnabled()) {
      logger.debug("Analysis done: " + errors.size() + " errors, " +
                   warnings.size() + " warnings, " +
                   scopes.getScopes().size() + " scopes");
    }
    if (!errors.isEmpty()) {
      throw errors.get(0);
    }
  }

  /**
   * @return all errors in the order found
   */
  public List<CompileException> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  /**
   * @return warnings formatted as "Line n: message"
   */
  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  public ScopeTree getScopes() {
    return scopes;
  }

  private void error(CompileException e) {
    LogHelper.debug(scopes.currentLevel(), "error: " + e.getMessage());
    errors.add(e);
  }

  private void warn(KernelAST node, String msg) {
    warnings.add("Line " + node.getLine() + ": " + msg);
  }

  private void warn(int line, String msg) {
    warnings.add("Line " + line + ": " + msg);
  }

  private void enterScope(KernelAST node, String name) {
    int id = scopes.enterScope(name);
    LogHelper.trace(scopes.currentLevel(), node, "enter scope " + name +
                                                 "#" + id);
  }

  private void leaveScope(KernelAST node) {
    LogHelper.trace(scopes.currentLevel(), node, "leave scope " +
                                           scopes.currentScope().getName());
    scopes.leaveScope();
  }

  private void visit(KernelAST node) {
    switch (node.kind()) {
      case FUNCTION_DECL:
        visitFunction((FunctionDecl)node);
        break;
      case VARIABLE_DECL:
        visitVariableDecl((VariableDecl)node);
        break;
      case ARRAY_DECL:
        visitArrayDecl((ArrayDeclaration)node);
        break;
      case STRUCT_DECL:
      case UNION_DECL:
        visitAggregate((AggregateDecl)node);
        break;
      case ENUM_DECL:
        visitEnum((EnumDecl)node);
        break;
      case TYPEDEF:
        visitTypedef((Typedef)node);
        break;
      case DEFINE:
        visitDefine((Define)node);
        break;
      case IF:
        visitIf((If)node);
        break;
      case WHILE:
        visitWhile((While)node);
        break;
      case FOR:
        visitFor((For)node);
        break;
      case ASSIGNMENT:
        visitAssignment((Assignment)node);
        break;
      case VARIABLE:
        visitVariable((Variable)node);
        break;
      case BINARY_OP:
        visitBinaryOp((BinaryOp)node);
        break;
      case CALL:
        visitCall((Call)node);
        break;
      case SIZEOF:
        visitSizeOf((SizeOf)node);
        break;
      default:
        for (KernelAST child: node.children()) {
          visit(child);
        }
        break;
    }
  }

  private void visitStatements(Block block) {
    for (KernelAST stmt: block.getStatements()) {
      visit(stmt);
    }
  }

  private void visitFunction(FunctionDecl func) {
    String name = func.getName();
    Type returnType = func.getReturnType().toType();
    Symbol existing = scopes.lookupLocal(name);
    if (existing != null && isCompatibleDeclaration(existing, func)) {
      LogHelper.trace(scopes.currentLevel(), func,
                      "function " + name + " matches earlier prototype");
    } else {
      try {
        scopes.declare(name, Symbol.Kind.FUNCTION,
                       new FunctionType(returnType), func, true);
      } catch (DoubleDefineException e) {
        error(e);
      }
    }

    if (func.getBody() == null) {
      return;
    }

    enterScope(func, "function:" + name);
    for (Param param: func.getParams()) {
      if (param.getName() == null) {
        continue;
      }
      try {
        Symbol sym = scopes.declare(param.getName(), Symbol.Kind.PARAMETER,
                              param.getType().toType(), param, false);
        sym.markInitialized();
      } catch (DoubleDefineException e) {
        error(e);
      }
    }
    visitStatements(func.getBody());

    if (!func.getReturnType().isVoid() && !guaranteesReturn(func.getBody())) {
      warn(func, "Function '" + name + "' may not return a value");
    }
    leaveScope(func);
  }

  /**
   * A function may be declared again with the same return type if at
   * most one of the declarations has a body
   */
  private static boolean isCompatibleDeclaration(Symbol existing,
                                                 FunctionDecl func) {
    if (existing.getKind() != Symbol.Kind.FUNCTION ||
        !(existing.getDeclaration() instanceof FunctionDecl)) {
      return false;
    }
    FunctionDecl prev = (FunctionDecl)existing.getDeclaration();
    return (prev.isPrototype() || func.isPrototype()) &&
           prev.getReturnType().toType().equals(
                                     func.getReturnType().toType());
  }

  /**
   * Syntactic check that every path through a statement returns
   */
  static boolean guaranteesReturn(KernelAST stmt) {
    if (stmt == null) {
      return false;
    }
    switch (stmt.kind()) {
      case RETURN:
        return true;
      case BLOCK:
        for (KernelAST s: ((Block)stmt).getStatements()) {
          if (guaranteesReturn(s)) {
            return true;
          }
        }
        return false;
      case IF:
        If ifStmt = (If)stmt;
        return ifStmt.hasElse() && guaranteesReturn(ifStmt.getThen()) &&
               guaranteesReturn(ifStmt.getElse());
      default:
        return false;
    }
  }

  private void checkTypeExists(TypeSpec type, KernelAST node) {
    String name = type.baseName();
    if (!Builtins.isType(name) && scopes.lookup(name) == null) {
      error(new UndefinedTypeException(node.getLine(), node.getColumn(),
                                       name));
    }
  }

  private Symbol declare(String name, Type type, KernelAST node,
                         boolean constant) {
    try {
      Symbol sym = scopes.declare(name, declKind, type, node, constant);
      LogHelper.trace(scopes.currentLevel(), node, "declare " + sym);
      return sym;
    } catch (DoubleDefineException e) {
      error(e);
      return null;
    }
  }

  private void visitVariableDecl(VariableDecl decl) {
    checkTypeExists(decl.getType(), decl);
    Symbol sym = declare(decl.getName(), decl.getType().toType(), decl,
                         decl.isConst());

    KernelAST value = decl.getValue();
    if (value != null) {
      visit(value);
      String typeName = decl.getType().toString();
      if (value instanceof NumberLiteral &&
          !typeName.contains("int") && !typeName.contains("float")) {
        warn(decl, "Initializing '" + typeName + "' variable '" +
                   decl.getName() + "' with a number");
      }
      if (sym != null) {
        sym.markInitialized();
      }
    }
  }

  private void visitArrayDecl(ArrayDeclaration decl) {
    checkTypeExists(decl.getElementType(), decl);
    Symbol sym = declare(decl.getName(),
                         new ArrayType(decl.getElementType().toType()),
                         decl, decl.isConst());

    KernelAST size = decl.getSize();
    if (size != null) {
      visit(size);
      if (size instanceof NumberLiteral &&
          ((NumberLiteral)size).getValue().doubleValue() <= 0) {
        error(new CompileException(size.getLine(), size.getColumn(),
              "Size of array '" + decl.getName() + "' must be positive"));
      }
    }
    for (KernelAST init: decl.getInitializers()) {
      visit(init);
    }
    if (decl.hasInitializer() && sym != null) {
      sym.markInitialized();
    }
  }

  private void visitAggregate(AggregateDecl decl) {
    String tag = decl.isUnion() ? "union" : "struct";
    if (!decl.getName().isEmpty()) {
      declareType(decl.getName(),
                  new StructType(decl.getName(), decl.isUnion()), decl);
    }

    enterScope(decl, tag + ":" + decl.getName());
    Symbol.Kind outerKind = declKind;
    declKind = Symbol.Kind.FIELD;
    try {
      for (KernelAST field: decl.getFields()) {
        visit(field);
      }
    } finally {
      declKind = outerKind;
    }
    leaveScope(decl);
  }

  private void declareType(String name, Type type, KernelAST decl) {
    try {
      scopes.declare(name, Symbol.Kind.TYPE, type, decl, true);
    } catch (DoubleDefineException e) {
      error(e);
    }
  }

  private void visitEnum(EnumDecl decl) {
    Type type = Types.INT;
    if (!decl.getName().isEmpty()) {
      type = new EnumType(decl.getName());
      declareType(decl.getName(), type, decl);
    }
    for (Map.Entry<String, Number> e: decl.getValues().entrySet()) {
      KernelAST init = decl.getInitializer(e.getKey());
      if (init != null) {
        visit(init);
      }
      try {
        Symbol sym = scopes.declare(e.getKey(), Symbol.Kind.ENUM_CONSTANT,
                                    type, decl, true);
        sym.markInitialized();
      } catch (DoubleDefineException ex) {
        error(ex);
      }
    }
  }

  private void visitTypedef(Typedef decl) {
    checkTypeExists(decl.getType(), decl);
    declareType(decl.getAlias(), decl.getType().toType(), decl);
  }

  private void visitDefine(Define decl) {
    if (decl.getValue() != null) {
      visit(decl.getValue());
    }
    try {
      Symbol sym = scopes.declare(decl.getName(), Symbol.Kind.MACRO,
                                  Types.INT, decl, true);
      sym.markInitialized();
    } catch (DoubleDefineException e) {
      error(e);
    }
  }

  private void visitIf(If stmt) {
    visit(stmt.getCondition());
    enterScope(stmt, "if_then");
    visit(stmt.getThen());
    leaveScope(stmt);
    if (stmt.hasElse()) {
      enterScope(stmt, "if_else");
      visit(stmt.getElse());
      leaveScope(stmt);
    }
  }

  private void visitWhile(While stmt) {
    visit(stmt.getCondition());
    enterScope(stmt, "while");
    visit(stmt.getBody());
    leaveScope(stmt);
  }

  private void visitFor(For stmt) {
    if (stmt.getInit() != null) {
      visit(stmt.getInit());
    }
    if (stmt.getCondition() != null) {
      visit(stmt.getCondition());
    }
    if (stmt.getIncrement() != null) {
      visit(stmt.getIncrement());
    }
    enterScope(stmt, "for");
    visit(stmt.getBody());
    leaveScope(stmt);
  }

  /**
   * Assigning to a bare identifier counts as a use of it
   */
  private void visitAssignment(Assignment assign) {
    KernelAST left = assign.getLeft();
    if (left instanceof Variable) {
      String name = ((Variable)left).getName();
      Symbol sym = scopes.lookup(name);
      if (sym == null) {
        error(new UndefinedVarError(left.getLine(), left.getColumn(), name));
      } else {
        sym.markUsed();
        if (sym.isConstant()) {
          error(new InvalidWriteException(assign.getLine(),
                                          assign.getColumn(), name));
        }
        sym.markInitialized();
      }
    } else {
      visit(left);
    }
    visit(assign.getRight());
  }

  private void visitVariable(Variable var) {
    Symbol sym = scopes.lookup(var.getName());
    if (sym == null) {
      error(new UndefinedVarError(var.getLine(), var.getColumn(),
                                  var.getName()));
    } else {
      sym.markUsed();
    }
  }

  private void visitBinaryOp(BinaryOp op) {
    visit(op.getLeft());
    visit(op.getRight());
    if (op.getOp().equals("/") &&
        op.getRight() instanceof NumberLiteral &&
        ((NumberLiteral)op.getRight()).isZero()) {
      KernelAST right = op.getRight();
      error(new CompileException(right.getLine(), right.getColumn(),
                                 "Division by zero"));
    }
  }

  /**
   * Arguments are not checked against the function signature
   */
  private void visitCall(Call call) {
    visit(call.getFunction());
    for (KernelAST arg: call.getArgs()) {
      visit(arg);
    }
  }

  /**
   * sizeof(x) parses as a type name; it may equally name a variable
   */
  private void visitSizeOf(SizeOf sizeOf) {
    if (!sizeOf.isType()) {
      visit(sizeOf.getExpression());
      return;
    }
    String name = sizeOf.getType().baseName();
    Symbol sym = scopes.lookup(name);
    if (sym != null) {
      sym.markUsed();
    } else if (!Builtins.isType(name)) {
      error(new UndefinedTypeException(sizeOf.getLine(),
                                       sizeOf.getColumn(), name));
    }
  }

  /**
   * Warn about every symbol in any scope that was never referenced,
   * other than types and functions
   */
  private void reportUnused() {
    for (Scope scope: scopes.getScopes()) {
      for (Symbol sym: scope.getSymbols()) {
        if (!sym.isUsed() && sym.getKind().reportUnused() &&
            !sym.getName().startsWith("_")) {
          warn(sym.getLine(), "Unused " + sym.getKind().describe() + " '" +
                              sym.getName() + "'");
        }
      }
    }
  }
}
