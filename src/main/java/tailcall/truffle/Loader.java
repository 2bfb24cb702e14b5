package tailcall.truffle;

import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Conditional;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Literal;
import tailcall.truffle.ast.Names;
import tailcall.truffle.ast.Operation;
import tailcall.truffle.ast.Program;
import tailcall.truffle.ast.Variable;
import tailcall.truffle.core.SurfaceModel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 把 JSON 形式的源程序读成表达式树。
 *
 * 未知的 {@code kind}、缺失字段、非平凡运算符、非法字面量以及含保留字符 {@code $} 的标识符
 * 都报告为 {@link MalformedExpressionException}；JSON 本身无法解析时抛出 {@link IOException}。
 */
public final class Loader {
  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public Expr load(File f) throws IOException {
    try {
      return toExpr(mapper.readValue(f, SurfaceModel.Form.class));
    } catch (InvalidTypeIdException e) {
      throw unknownKind(e);
    }
  }

  public Expr load(String json) throws IOException {
    try {
      return toExpr(mapper.readValue(json, SurfaceModel.Form.class));
    } catch (InvalidTypeIdException e) {
      throw unknownKind(e);
    }
  }

  private static MalformedExpressionException unknownKind(InvalidTypeIdException e) {
    String kind = e.getTypeId() == null ? "<missing kind>" : e.getTypeId();
    return new MalformedExpressionException("Unrecognized node kind: " + kind, kind);
  }

  public Expr toExpr(SurfaceModel.Form form) {
    if (form == null) {
      throw new MalformedExpressionException("Missing expression", "null");
    }
    if (form instanceof SurfaceModel.Bool b) {
      return new Literal(require(b.value, "Bool.value"));
    }
    if (form instanceof SurfaceModel.Num n) {
      return new Literal(require(n.value, "Number.value"));
    }
    if (form instanceof SurfaceModel.Name n) {
      return new Variable(identifier(n.name));
    }
    if (form instanceof SurfaceModel.Op op) {
      return new Operation(require(op.op, "Op.op"), toExprs(op.args));
    }
    if (form instanceof SurfaceModel.If cond) {
      return Conditional.of(toExpr(cond.test), toExpr(cond.conseq), toExpr(cond.alt));
    }
    if (form instanceof SurfaceModel.Fn fn) {
      return new Abstraction(identifiers(fn.params), toExpr(fn.body));
    }
    if (form instanceof SurfaceModel.Defn defn) {
      return new Definition(identifier(defn.name), identifiers(defn.params), toExpr(defn.body));
    }
    if (form instanceof SurfaceModel.Call call) {
      return new Application(toExpr(call.target), toExprs(call.args));
    }
    if (form instanceof SurfaceModel.Module module) {
      return new Program(toExprs(module.forms));
    }
    throw new MalformedExpressionException("Unrecognized node kind", form.getClass().getSimpleName());
  }

  private List<Expr> toExprs(List<SurfaceModel.Form> forms) {
    List<Expr> out = new ArrayList<>();
    if (forms != null) {
      for (var f : forms) out.add(toExpr(f));
    }
    return out;
  }

  private static List<String> identifiers(List<String> names) {
    List<String> out = new ArrayList<>();
    if (names != null) {
      for (String n : names) out.add(identifier(n));
    }
    return out;
  }

  private static String identifier(String name) {
    require(name, "identifier");
    if (Names.isGenerated(name)) {
      throw new MalformedExpressionException(
          "Identifier must not contain reserved character '" + Names.GENERATED_SEPARATOR + "'", name);
    }
    return name;
  }

  private static <T> T require(T value, String field) {
    if (value == null) {
      throw new MalformedExpressionException("Missing field " + field, field);
    }
    return value;
  }
}
