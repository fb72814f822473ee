package exm.ksc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.ksc.common.exceptions.DoubleDefineException;
import exm.ksc.common.exceptions.KSCRuntimeError;
import exm.ksc.common.lang.Types;

public class ScopeTreeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testLookupWalksOutward() throws DoubleDefineException {
    ScopeTree scopes = new ScopeTree();
    Symbol outer = scopes.declare("x", Symbol.Kind.VARIABLE, Types.INT,
                                  null, false);
    scopes.enterScope("inner");
    assertSame(outer, scopes.lookup("x"));
    assertNull(scopes.lookupLocal("x"));

    Symbol inner = scopes.declare("x", Symbol.Kind.VARIABLE, Types.INT,
                                  null, false);
    assertSame("Innermost declaration wins", inner, scopes.lookup("x"));
    assertEquals(1, inner.getLevel());

    scopes.leaveScope();
    assertSame(outer, scopes.lookup("x"));
    assertNull(scopes.lookup("y"));
  }

  @Test
  public void testRedefinition() throws DoubleDefineException {
    ScopeTree scopes = new ScopeTree();
    scopes.declare("x", Symbol.Kind.VARIABLE, Types.INT, null, false);
    exception.expect(DoubleDefineException.class);
    scopes.declare("x", Symbol.Kind.FUNCTION, Types.INT, null, true);
  }

  @Test
  public void testExitedScopesRetained() {
    ScopeTree scopes = new ScopeTree();
    int a = scopes.enterScope("a");
    int b = scopes.enterScope("b");
    scopes.leaveScope();
    scopes.leaveScope();
    int c = scopes.enterScope("c");

    assertEquals(4, scopes.getScopes().size());
    Scope global = scopes.globalScope();
    assertEquals(2, global.getChildren().size());
    assertTrue(global.getChildren().contains(a));
    assertTrue(global.getChildren().contains(c));
    assertEquals(a, scopes.getScope(b).getParent());
    assertEquals(2, scopes.getScope(b).getLevel());
    assertEquals(Scope.NO_PARENT, global.getParent());
  }

  @Test
  public void testCannotLeaveGlobal() {
    ScopeTree scopes = new ScopeTree();
    exception.expect(KSCRuntimeError.class);
    scopes.leaveScope();
  }

  @Test
  public void testBuiltinsRegistered() {
    ScopeTree scopes = new ScopeTree();
    Builtins.register(scopes);
    Symbol intSym = scopes.lookup("int");
    assertEquals(Symbol.Kind.TYPE, intSym.getKind());
    assertEquals(0, intSym.getLevel());
    assertTrue(scopes.lookup("bool") != null);
    assertTrue(Builtins.isType("double"));
  }
}
