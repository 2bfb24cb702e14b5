package tailcall.truffle.core;

import com.fasterxml.jackson.annotation.*;
import java.util.*;

/**
 * 源语言的 JSON 表示。每个文档是一个表达式，按 {@code kind} 区分节点种类。
 */
public final class SurfaceModel {

  private SurfaceModel() {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Bool.class, name = "Bool"),
    @JsonSubTypes.Type(value = Num.class, name = "Number"),
    @JsonSubTypes.Type(value = Name.class, name = "Name"),
    @JsonSubTypes.Type(value = Op.class, name = "Op"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Fn.class, name = "Fn"),
    @JsonSubTypes.Type(value = Defn.class, name = "Defn"),
    @JsonSubTypes.Type(value = Call.class, name = "Call"),
    @JsonSubTypes.Type(value = Module.class, name = "Module")
  })
  public sealed interface Form permits Bool, Num, Name, Op, If, Fn, Defn, Call, Module {}

  @JsonTypeName("Bool") public static final class Bool implements Form { public Boolean value; }
  @JsonTypeName("Number") public static final class Num implements Form { public java.lang.Number value; }
  @JsonTypeName("Name") public static final class Name implements Form { public String name; }
  @JsonTypeName("Op") public static final class Op implements Form { public String op; public List<Form> args; }
  @JsonTypeName("If") public static final class If implements Form { public Form test; public Form conseq; public Form alt; }
  @JsonTypeName("Fn") public static final class Fn implements Form { public List<String> params; public Form body; }
  @JsonTypeName("Defn")
  public static final class Defn implements Form {
    public String name;
    public List<String> params;
    public Form body;
  }
  @JsonTypeName("Call") public static final class Call implements Form { public Form target; public List<Form> args; }
  @JsonTypeName("Module") public static final class Module implements Form { public List<Form> forms; }
}
