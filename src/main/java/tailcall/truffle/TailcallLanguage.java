package tailcall.truffle;

import tailcall.truffle.ast.Expr;
import tailcall.truffle.nodes.NodeBuilder;
import tailcall.truffle.nodes.TailcallRootNode;
import tailcall.truffle.runtime.TailcallConfig;
import tailcall.truffle.runtime.TailcallRuntimeException;
import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.TruffleLanguage;
import com.oracle.truffle.api.source.Source;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tailcall 语言 Truffle 实现
 * <p>
 * 输入是 JSON 形式的源程序，支持两种执行模式：
 * <ul>
 *   <li><b>编译</b>（{@value #MIME_COMPILE}，默认）：经 CPS、thunk 化与蹦床插入后执行，宿主栈深度有界</li>
 *   <li><b>直接</b>（{@value #MIME_DIRECT}）：不经编译直接求值源树，作为参考语义</li>
 * </ul>
 * 未指定 MIME 类型时由环境变量 {@code TAILCALL_MODE} 决定。
 */
@TruffleLanguage.Registration(
    id = TailcallLanguage.ID,
    name = "Tailcall",
    version = "0.1",
    characterMimeTypes = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT},
    defaultMimeType = TailcallLanguage.MIME_COMPILE)
public final class TailcallLanguage extends TruffleLanguage<TailcallContext> {
  private static final Logger LOGGER = Logger.getLogger(TailcallLanguage.class.getName());

  public static final String ID = "tailcall";
  /** 编译后执行 */
  public static final String MIME_COMPILE = "application/x-tailcall+json";
  /** 直接求值源树 */
  public static final String MIME_DIRECT = "application/x-tailcall-direct+json";

  @Override
  protected TailcallContext createContext(Env env) {
    return new TailcallContext(env);
  }

  @Override
  protected CallTarget parse(ParsingRequest request) throws Exception {
    Source source = request.getSource();
    boolean direct = isDirect(source.getMimeType());

    Expr tree;
    try {
      Expr surface = new Loader().load(source.getCharacters().toString());
      tree = direct ? surface : new TrampolineCompiler().compile(surface);
    } catch (TailcallException | IOException e) {
      LOGGER.log(Level.WARNING, "无法加载程序 {0}: {1}", new Object[]{source.getName(), e.getMessage()});
      throw new TailcallRuntimeException(e.getMessage());
    }

    NodeBuilder builder = new NodeBuilder(this);
    TailcallRootNode rootNode = new TailcallRootNode(this, builder.build(tree), !direct);
    return rootNode.getCallTarget();
  }

  static boolean isDirect(String mimeType) {
    if (mimeType == null) {
      return TailcallConfig.isDirectByDefault();
    }
    return MIME_DIRECT.equals(mimeType);
  }
}
