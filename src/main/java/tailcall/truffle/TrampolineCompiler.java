package tailcall.truffle;

import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Program;
import tailcall.truffle.emit.SourceEmitter;
import tailcall.truffle.passes.ContinuationAbstraction;
import tailcall.truffle.passes.CpsConverter;
import tailcall.truffle.passes.FreshNames;
import tailcall.truffle.passes.MiniPasses;
import tailcall.truffle.passes.Thunkifier;
import tailcall.truffle.passes.TrampolineInserter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 蹦床编译器
 * <p>
 * 把源表达式树编译为可在常数宿主栈深度下执行的目标树。
 * <p>
 * 编译管道：
 * <pre>
 * JSON → Loader → 源树 → CPS 转换 → 续延抽象 → Thunk 化 → 蹦床插入 → 目标树
 * </pre>
 * <p>
 * 不是定义的顶层表达式先包装成零参数的入口定义，编译后紧跟一次以最终续延发起的调用，
 * 使整个程序求值为该表达式的值。各阶段都是纯函数，任何阶段失败都不会产生部分输出。
 */
public final class TrampolineCompiler {

    private static final Logger LOGGER = Logger.getLogger(TrampolineCompiler.class.getName());

    private final CompilerOptions options;

    public TrampolineCompiler() {
        this(CompilerOptions.defaults());
    }

    public TrampolineCompiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * 编译源树
     *
     * @param surface 源树（单个顶层形式或程序）
     * @return 目标树
     * @throws MalformedExpressionException 输入含有无法识别的节点
     * @throws InvariantViolationException 编译器内部错误
     */
    public Expr compile(Expr surface) {
        FreshNames names = options.newFreshNames();
        String tramp = names.fresh(options.getTrampolineBase());
        String applyK = names.fresh(options.getDispatcherBase());

        // 1. 顶层表达式包装为入口定义
        List<Expr> forms = surface instanceof Program program ? program.forms() : List.of(surface);
        List<Expr> prepared = new ArrayList<>(forms.size());
        List<String> entries = new ArrayList<>(forms.size());
        for (Expr form : forms) {
            if (form instanceof Definition) {
                prepared.add(form);
                entries.add(null);
            } else {
                String entry = names.fresh(options.getEntryBase());
                prepared.add(MiniPasses.wrapEntry(entry, form));
                entries.add(entry);
            }
        }
        Expr tree = new Program(prepared);

        // 2. CPS 转换
        tree = new CpsConverter(names).convertTopLevel(tree);
        LOGGER.log(Level.FINE, "CPS conversion done ({0} names issued)", names.issued());

        // 3. 续延抽象
        tree = new ContinuationAbstraction(applyK).apply(tree);

        // 4. Thunk 化
        tree = Thunkifier.thunkify(tree);

        // 5. 蹦床插入
        tree = new TrampolineInserter(names, tramp, applyK).insert(tree);

        // 6. 入口调用与内建过程绑定
        List<Expr> converted = ((Program) tree).forms();
        List<Expr> out = new ArrayList<>(converted.size() * 2);
        for (int i = 0; i < converted.size(); i++) {
            out.add(converted.get(i));
            if (entries.get(i) != null) {
                out.add(MiniPasses.invokeEntry(entries.get(i)));
            }
        }
        Expr body = out.size() == 1 ? out.get(0) : new Program(out);
        LOGGER.log(Level.FINE, "compiled {0} top-level form(s)", forms.size());
        return MiniPasses.bindIntrinsics(body, tramp, applyK);
    }

    /**
     * 从 JSON 源程序编译
     *
     * @param json 源程序 JSON
     * @return 目标树
     * @throws CompilationException 输入无法解析或编译失败时抛出
     */
    public Expr compileJson(String json) throws CompilationException {
        try {
            return compile(new Loader().load(json));
        } catch (TailcallException e) {
            LOGGER.log(Level.WARNING, "编译失败: {0}", e.getMessage());
            throw new CompilationException(e.getMessage(), e);
        } catch (IOException e) {
            throw new CompilationException("JSON 解析失败: " + e.getMessage(), e);
        }
    }

    /**
     * 编译并渲染为源码文本
     */
    public String compileToSource(String json) throws CompilationException {
        return SourceEmitter.emit(compileJson(json));
    }

    /**
     * 编译异常
     */
    public static class CompilationException extends Exception {
        public CompilationException(String message) {
            super(message);
        }

        public CompilationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
