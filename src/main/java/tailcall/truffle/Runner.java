package tailcall.truffle;
import tailcall.truffle.nodes.Profiler;
import tailcall.truffle.runtime.TailcallConfig;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class Runner {
  public static void main(String[] args) throws Exception {
    if (args.length == 0) {
      usage();
      return;
    }

    File f = new File(args[0]);
    boolean emit = false;
    boolean direct = TailcallConfig.isDirectByDefault();
    List<String> functionArgs = new ArrayList<>();
    boolean collectingArgs = false;

    for (String a : Arrays.asList(args).subList(1, args.length)) {
      // -- 之后的参数全部交给程序
      if (collectingArgs) {
        functionArgs.add(a);
      } else if ("--".equals(a)) {
        collectingArgs = true;
      } else if ("--emit".equals(a)) {
        emit = true;
      } else if ("--direct".equals(a)) {
        direct = true;
      } else {
        System.err.println("Unknown option: " + a);
        usage();
        System.exit(2);
      }
    }

    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: input=" + f.getAbsolutePath() + ", direct=" + direct + ", emit=" + emit);
    }

    String json = Files.readString(f.toPath(), StandardCharsets.UTF_8);
    if (TailcallConfig.PROFILE) {
      Profiler.setEnabled(true);
    }

    if (emit) {
      try {
        System.out.println(new TrampolineCompiler().compileToSource(json));
      } catch (TrampolineCompiler.CompilationException e) {
        System.err.println(e.getMessage());
        System.exit(1);
      }
      return;
    }

    try (Context context = Context.newBuilder(TailcallLanguage.ID)
        .option("engine.WarnInterpreterOnly", "false")
        .build()) {

      Source source = Source.newBuilder(TailcallLanguage.ID, json, f.getName())
          .mimeType(direct ? TailcallLanguage.MIME_DIRECT : TailcallLanguage.MIME_COMPILE)
          .build();

      Value result = context.eval(source);
      if (!functionArgs.isEmpty() && result.canExecute()) {
        result = result.execute(convertArguments(functionArgs));
      }

      if (TailcallConfig.DEBUG) {
        System.err.println("DEBUG: result=" + result);
      }
      System.out.println(result);
    }

    if (TailcallConfig.PROFILE) {
      System.out.print(Profiler.dump());
    }
  }

  private static void usage() {
    System.err.println("Usage: Runner <file.json> [--emit] [--direct] [-- <args...>]");
    System.err.println("  --emit     Print the compiled program instead of running it");
    System.err.println("  --direct   Evaluate the program without compiling it");
    System.err.println("  --         Separator before function arguments");
    System.err.println("");
    System.err.println("Examples:");
    System.err.println("  Runner countdown.json -- 100000");
    System.err.println("  Runner factorial.json --emit");
  }

  /**
   * 将命令行字符串参数转换为整数、小数或布尔值。
   */
  private static Object[] convertArguments(List<String> args) {
    Object[] result = new Object[args.size()];
    for (int i = 0; i < args.size(); i++) {
      result[i] = parseArgument(args.get(i));
    }
    return result;
  }

  private static Object parseArgument(String arg) {
    if ("true".equalsIgnoreCase(arg)) return true;
    if ("false".equalsIgnoreCase(arg)) return false;
    try {
      return Long.parseLong(arg);
    } catch (NumberFormatException e) {
      // 不是整数，继续尝试小数
    }
    try {
      return Double.parseDouble(arg);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Argument must be a number or a boolean: " + arg, e);
    }
  }
}
