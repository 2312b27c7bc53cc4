package club.ppmc.kernel.worker;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeScriptTranspilerTest {

    private final TypeScriptTranspiler transpiler = new TypeScriptTranspiler();
    private Context context;

    @BeforeEach
    void setUp() {
        context = Context.newBuilder("js").option("engine.WarnInterpreterOnly", "false").build();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    private Value eval(String typeScript) {
        return context.eval("js", transpiler.transpile(typeScript));
    }

    @Test
    void erasesVariableAnnotations() {
        assertEquals("const n = 1", transpiler.transpile("const n: number = 1"));
    }

    @Test
    void erasesParameterAndReturnTypes() {
        assertEquals("function add(a, b) { return a + b }",
                transpiler.transpile("function add(a: number, b: number): number { return a + b }"));
    }

    @Test
    void removesInterfacesAndKeepsLineNumbers() {
        String js = transpiler.transpile("interface P {\n  x: number\n}\nconst p = 1");

        assertEquals("\n\n\nconst p = 1", js);
    }

    @Test
    void removesTypeAliases() {
        assertEquals(3, eval("type Pair = [number, number]\nconst p: Pair = [1, 2]\np[0] + p[1]").asInt());
    }

    @Test
    void removesAsAssertions() {
        assertEquals("const x = value", transpiler.transpile("const x = value as string").strip());
        assertEquals(4, eval("const raw: unknown = 'four';\n(raw as string).length").asInt());
    }

    @Test
    void removesNonNullAssertionButKeepsInequality() {
        assertEquals(2, eval("const m = new Map()\nm.set('a', 1)\nm.get('a')! + 1").asInt());
        assertTrue(eval("const a = 1\na !== 2").asBoolean());
    }

    @Test
    void erasesGenerics() {
        assertEquals(7, eval("function id<T>(v: T): T { return v }\nid<number>(7)").asInt());
        assertTrue(eval("const lt = 1 < 2\nlt").asBoolean());
    }

    @Test
    void convertsEnumsWithReverseMapping() {
        assertEquals("6:Green", eval("enum Color { Red, Green = 5, Blue }\nColor.Blue + ':' + Color[5]").asString());
    }

    @Test
    void convertsStringEnums() {
        assertEquals("up", eval("enum Dir { Up = 'up', Down = 'down' }\nDir.Up").asString());
    }

    @Test
    void turnsParameterPropertiesIntoAssignments() {
        Value sum = eval("class P {\n"
                + "  constructor(private x: number, public y = 2) {}\n"
                + "  sum(): number { return this.x + this.y }\n"
                + "}\n"
                + "new P(3).sum()");

        assertEquals(5, sum.asInt());
    }

    @Test
    void erasesClassFieldTypesAndModifiers() {
        Value value = eval("abstract class Base { abstract name(): string; greet(): string { return 'hi ' + this.name() } }\n"
                + "class Impl extends Base implements Named {\n"
                + "  private readonly label: string = 'impl'\n"
                + "  name(): string { return this.label }\n"
                + "}\n"
                + "new Impl().greet()");

        assertEquals("hi impl", value.asString());
    }

    @Test
    void erasesArrowFunctionTypes() {
        assertEquals(9, eval("const sq = (n: number): number => n * n\nsq(3)").asInt());
    }

    @Test
    void plainJavaScriptIsUnchanged() {
        String source = "const xs = [1, 2, 3].map(x => x * 2)\nconsole.log(xs)";

        assertEquals(source, transpiler.transpile(source));
    }
}
