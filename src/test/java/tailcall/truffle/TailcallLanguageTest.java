package tailcall.truffle;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Polyglot 端到端测试：编译模式与直接求值模式必须给出相同结果。
 */
public class TailcallLanguageTest {
    private Context context;

    @BeforeEach
    public void setUp() {
        context = newContext();
    }

    @AfterEach
    public void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    private static Context newContext() {
        return Context.newBuilder(TailcallLanguage.ID)
                .allowAllAccess(true)
                .option("engine.WarnInterpreterOnly", "false")
                .build();
    }

    private static String program(String name) throws IOException {
        try (InputStream in = TailcallLanguageTest.class.getResourceAsStream("/programs/" + name)) {
            assertNotNull(in, "缺少测试程序 " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Value eval(Context ctx, String json, String mimeType) throws IOException {
        Source source = Source.newBuilder(TailcallLanguage.ID, json, "test.json")
                .mimeType(mimeType)
                .build();
        return ctx.eval(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testFactorial(String mimeType) throws IOException {
        Value fact = eval(context, program("factorial.json"), mimeType);
        assertTrue(fact.canExecute(), "定义求值为可调用的函数");
        assertEquals(3628800L, fact.execute(10).asLong());
        assertEquals(1L, fact.execute(0).asLong());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testFibonacci(String mimeType) throws IOException {
        Value fib = eval(context, program("fib.json"), mimeType);
        assertEquals(610L, fib.execute(15).asLong());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testMutualRecursion(String mimeType) throws IOException {
        Value isEven = eval(context, program("even-odd.json"), mimeType);
        assertTrue(isEven.execute(100).asBoolean());
        assertFalse(isEven.execute(101).asBoolean());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testClosuresAndHigherOrderCalls(String mimeType) throws IOException {
        assertEquals(20L, eval(context, program("closures.json"), mimeType).asLong());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testTopLevelExpressionAfterDefinition(String mimeType) throws IOException {
        assertEquals(31L, eval(context, program("mixed.json"), mimeType).asLong());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testParameterShadowingDefinitionName(String mimeType) throws IOException {
        String identity = "{\"kind\":\"Defn\",\"name\":\"f\",\"params\":[\"f\"],\"body\":{\"kind\":\"Name\",\"name\":\"f\"}}";
        assertEquals(7L, eval(context, identity, mimeType).execute(7).asLong());

        String sum = "{\"kind\":\"Defn\",\"name\":\"f\",\"params\":[\"f\",\"n\"],\"body\":{\"kind\":\"Op\",\"op\":\"+\","
                + "\"args\":[{\"kind\":\"Name\",\"name\":\"f\"},{\"kind\":\"Name\",\"name\":\"n\"}]}}";
        assertEquals(11L, eval(context, sum, mimeType).execute(10, 1).asLong());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testReturnedFunctionIsExecutableFromHost(String mimeType) throws IOException {
        String json = "{\"kind\":\"Defn\",\"name\":\"adder\",\"params\":[\"n\"],\"body\":{\"kind\":\"Fn\",\"params\":[\"x\"],"
                + "\"body\":{\"kind\":\"Op\",\"op\":\"+\",\"args\":[{\"kind\":\"Name\",\"name\":\"x\"},{\"kind\":\"Name\",\"name\":\"n\"}]}}}";
        Value adder = eval(context, json, mimeType);
        Value addOne = adder.execute(1);
        assertTrue(addOne.canExecute(), "返回的函数应可由宿主直接调用");
        assertEquals(3L, addOne.execute(2).asLong());
        assertEquals(11L, addOne.execute(10).asLong());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testArithmetic(String mimeType) throws IOException {
        String half = "{\"kind\":\"Op\",\"op\":\"/\",\"args\":[{\"kind\":\"Number\",\"value\":1},{\"kind\":\"Number\",\"value\":2}]}";
        assertEquals(0.5, eval(context, half, mimeType).asDouble());
        String cond = "{\"kind\":\"If\",\"test\":{\"kind\":\"Number\",\"value\":0},"
                + "\"conseq\":{\"kind\":\"Number\",\"value\":1},\"alt\":{\"kind\":\"Number\",\"value\":2}}";
        assertEquals(1L, eval(context, cond, mimeType).asLong(), "0 为真");
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testDivisionByZeroIsGuestError(String mimeType) {
        String json = "{\"kind\":\"Op\",\"op\":\"/\",\"args\":[{\"kind\":\"Number\",\"value\":1},{\"kind\":\"Number\",\"value\":0}]}";
        PolyglotException e = assertThrows(PolyglotException.class, () -> eval(context, json, mimeType));
        assertTrue(e.isGuestException());
        assertTrue(e.getMessage().contains("division by zero"), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {TailcallLanguage.MIME_COMPILE, TailcallLanguage.MIME_DIRECT})
    public void testUnboundVariable(String mimeType) {
        String json = "{\"kind\":\"Call\",\"target\":{\"kind\":\"Name\",\"name\":\"missing\"},\"args\":[]}";
        PolyglotException e = assertThrows(PolyglotException.class, () -> eval(context, json, mimeType));
        assertTrue(e.getMessage().contains("unbound variable: missing"), e.getMessage());
    }

    @Test
    public void testMalformedProgramIsRejected() {
        PolyglotException e = assertThrows(PolyglotException.class,
                () -> eval(context, "{\"kind\":\"Loop\"}", TailcallLanguage.MIME_COMPILE));
        assertTrue(e.getMessage().contains("Malformed expression"), e.getMessage());
    }

    @Test
    public void testCompiledFunctionValueIsExecutableFromHost() throws IOException {
        String json = "{\"kind\":\"Fn\",\"params\":[\"x\"],\"body\":{\"kind\":\"Op\",\"op\":\"*\","
                + "\"args\":[{\"kind\":\"Name\",\"name\":\"x\"},{\"kind\":\"Name\",\"name\":\"x\"}]}}";
        Value square = eval(context, json, TailcallLanguage.MIME_COMPILE);
        assertTrue(square.canExecute());
        assertEquals(49L, square.execute(7).asLong());
    }

    @Test
    public void testDefaultMimeTypeCompiles() throws IOException {
        Value countdown = context.eval(TailcallLanguage.ID, program("countdown.json"));
        assertEquals(0L, countdown.execute(10).asLong());
    }

    /**
     * 在小栈线程中运行 countdown：编译模式的宿主栈深度与递归深度无关，直接模式会耗尽栈。
     */
    private static Throwable countdownOnSmallStack(String mimeType, long n, AtomicReference<Object> result)
            throws InterruptedException {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread worker = new Thread(null, () -> {
            try (Context ctx = newContext()) {
                Value countdown = eval(ctx, program("countdown.json"), mimeType);
                result.set(countdown.execute(n).asLong());
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "tailcall-small-stack", 1024 * 1024);
        worker.start();
        worker.join();
        return failure.get();
    }

    @Test
    public void testCompiledCountdownRunsInBoundedStack() throws InterruptedException {
        AtomicReference<Object> result = new AtomicReference<>();
        Throwable failure = countdownOnSmallStack(TailcallLanguage.MIME_COMPILE, 100_000, result);
        assertNull(failure, () -> "编译模式不应耗尽栈: " + failure);
        assertEquals(0L, result.get());
    }

    @Test
    public void testDirectCountdownExhaustsStack() throws InterruptedException {
        AtomicReference<Object> result = new AtomicReference<>();
        Throwable failure = countdownOnSmallStack(TailcallLanguage.MIME_DIRECT, 100_000, result);
        assertNotNull(failure, "直接求值的深递归应当失败");
        assertNull(result.get());
    }
}
