package club.ppmc.kernel.worker;

/** JavaScript 单元格原样执行。 */
final class JavaScriptTranspiler implements Transpiler {

    static final JavaScriptTranspiler INSTANCE = new JavaScriptTranspiler();

    private JavaScriptTranspiler() {}

    @Override
    public String transpile(String source) {
        return source;
    }

    @Override
    public String fileExtension() {
        return "js";
    }
}
