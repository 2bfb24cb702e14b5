package tailcall.truffle.passes;

import static org.junit.jupiter.api.Assertions.*;
import static tailcall.truffle.ast.Trees.*;

import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.Names;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class FreshNamesTest {

  @Test
  void namesAreUniqueAndMarkedAsGenerated() {
    FreshNames names = new FreshNames();
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      String n = names.fresh("k");
      assertTrue(Names.isGenerated(n));
      assertTrue(seen.add(n), "重复的新鲜名字: " + n);
    }
    assertEquals(100, names.issued());
  }

  @Test
  void generatedSuffixIsReplaced() {
    FreshNames names = new FreshNames(6);
    assertEquals("loop$7", names.fresh("loop$3"));
  }

  @Test
  void resetRestartsCounter() {
    FreshNames names = new FreshNames();
    names.fresh("a");
    names.reset();
    assertEquals("a$1", names.fresh("a"));
  }

  @Test
  void renameReplacesFreeOccurrences() {
    Expr renamed = Renamer.rename(call("f", var("f"), var("x")), "f", "f$1");
    assertEquals(call("f$1", var("f$1"), var("x")), renamed);
  }

  @Test
  void renameStopsAtRebindingForms() {
    Expr shadowed = fn(List.of("f"), call("f", num(1)));
    assertEquals(shadowed, Renamer.rename(shadowed, "f", "f$1"));

    Let let = new Let("f", var("f"), var("f"));
    assertEquals(new Let("f", var("f$1"), var("f")), Renamer.rename(let, "f", "f$1"),
        "let 的值在外层作用域，主体被遮蔽");
  }
}
