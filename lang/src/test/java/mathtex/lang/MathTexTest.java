package mathtex.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class MathTexTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        var file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Test
    void compile() throws IOException {
        assertEquals(0, MathTex.run(new String[] {"--compile", "a/b"}));
        assertEquals(0, MathTex.run(new String[] {"--display", "--compile", "sqrt(x, 3)"}));
    }

    @Test
    void compileFailure() throws IOException {
        assertEquals(1, MathTex.run(new String[] {"--compile", "a+"}));
    }

    @Test
    void usageErrors() throws IOException {
        assertEquals(64, MathTex.run(new String[] {"--compile"}));
        assertEquals(64, MathTex.run(new String[] {"--bogus"}));
        assertEquals(64, MathTex.run(new String[] {"--inline"}));
        assertEquals(0, MathTex.run(new String[] {"--help"}));
    }

    @Test
    void mixedContentFile() throws IOException {
        var input = write("notes.txt", "Text $x^2$\nplain");
        var output = dir.resolve("out.tex");
        assertEquals(0, MathTex.run(new String[] {input.toString(), "--output", output.toString()}));
        assertEquals("Text $x^{2}$\\\\\nplain\\\\", read(output));
    }

    @Test
    void defaultOutputName() throws IOException {
        var input = write("doc.txt", "$a+b$");
        assertEquals(0, MathTex.run(new String[] {input.toString()}));
        assertEquals("$a + b$\\\\", read(dir.resolve("doc.tex")));
    }

    @Test
    void wholeLineDisplayFile() throws IOException {
        var input = write("lines.txt", "Heading\nx^2 + 1");
        var output = dir.resolve("lines.tex");
        assertEquals(0, MathTex.run(new String[] {"--whole-line", "--display", input.toString(), "-o", output.toString()}));
        assertEquals("Heading\n$$x^{2} + 1$$", read(output));
    }

    @Test
    void templateFile() throws IOException {
        var input = write("in.txt", "$pi$");
        var template = write("page.tex", "BEGIN\n{{ generated }}\nEND\n");
        var output = dir.resolve("page-out.tex");
        assertEquals(0, MathTex.run(new String[] {
            input.toString(), "--template", template.toString(), "--output", output.toString()}));
        assertEquals("BEGIN\n$\\pi$\\\\\nEND\n", read(output));
    }

    @Test
    void customSymbols() throws IOException {
        var symbols = write("symbols.txt", "x = \\chi\n");
        var input = write("in.txt", "$x+alpha$");
        var output = dir.resolve("custom.tex");
        assertEquals(0, MathTex.run(new String[] {
            "--symbols", symbols.toString(), input.toString(), "--output", output.toString()}));
        assertEquals("$\\chi + alpha$\\\\", read(output));
    }

    @Test
    void missingFiles() throws IOException {
        assertEquals(1, MathTex.run(new String[] {dir.resolve("missing.txt").toString()}));

        var input = write("in.txt", "$x$");
        assertEquals(1, MathTex.run(new String[] {input.toString(), "--template", dir.resolve("none.tex").toString()}));
        assertFalse(Files.exists(dir.resolve("in.tex")));
    }

    @Test
    void blankTemplateFails() throws IOException {
        var input = write("in.txt", "$x$");
        var template = write("blank.tex", "   ");
        assertEquals(1, MathTex.run(new String[] {input.toString(), "--template", template.toString()}));
        assertTrue(Files.notExists(dir.resolve("in.tex")));
    }

    @Test
    void createTemplate() throws IOException {
        var template = dir.resolve("my-template.tex");
        assertEquals(0, MathTex.run(new String[] {"--create-template", template.toString()}));
        assertEquals(DocumentProcessor.sampleTemplate(), read(template));
        assertTrue(read(template).contains(DocumentProcessor.PLACEHOLDER));
    }

    @Test
    void createSample() throws IOException {
        var sample = dir.resolve("my-sample.txt");
        assertEquals(0, MathTex.run(new String[] {"--create-sample", sample.toString()}));
        assertEquals(DocumentProcessor.sampleDocument(), read(sample));

        var legacy = dir.resolve("legacy.txt");
        assertEquals(0, MathTex.run(new String[] {"--create_sample", legacy.toString()}));
        assertEquals(DocumentProcessor.sampleDocument(), read(legacy));
    }

    @Test
    void createBothThenProcess() throws IOException {
        var template = dir.resolve("template.tex");
        var sample = dir.resolve("sample.txt");
        assertEquals(0, MathTex.run(new String[] {
            "--create-template", template.toString(), "--create-sample", sample.toString()}));

        var output = dir.resolve("sample-out.tex");
        assertEquals(0, MathTex.run(new String[] {
            sample.toString(), "--template", template.toString(), "--output", output.toString()}));
        var tex = read(output);
        assertTrue(tex.startsWith("\\documentclass{article}"));
        assertTrue(tex.contains("\\maketitle"));
        assertTrue(tex.contains("Some text here $a + b$\\\\\n"));
        assertTrue(tex.contains("$sqrt(sin(alpha+1)/inf))$\\\\\n"));
        assertFalse(tex.contains(DocumentProcessor.PLACEHOLDER));
    }

    @Test
    void promptSamples() {
        var text = MathTex.samples(Transpiler.withDefaultSymbols(), MathMode.INLINE);
        assertTrue(text.startsWith("Basic algebra:\n  Input:  x^2 + 3*y - 5\n  LaTeX:  $"));
        assertTrue(text.contains("Fractions:\n  Input:  (a + b) / (c - d)\n  LaTeX:  $\\frac{a + b}{c - d}$\n"));
        assertTrue(text.contains("  LaTeX:  $\\alpha + \\beta \\cdot \\gamma$"));
        assertFalse(text.contains("Error:"));
        assertEquals(MathTex.SAMPLES.size(), text.split("  Input:  ", -1).length - 1);
    }

    @Test
    void promptSamplesDisplay() {
        var text = MathTex.samples(Transpiler.withDefaultSymbols(), MathMode.DISPLAY);
        assertTrue(text.contains("  LaTeX:  $$\\sqrt{x^{2} + y^{2}}$$"));
    }

    @Test
    void promptHelp() {
        var help = MathTex.promptHelp();
        assertTrue(help.contains("help, h"));
        assertTrue(help.contains("sample, samples"));
        assertTrue(help.contains("clear, cls"));
        assertTrue(help.contains("quit, exit, q, :q"));
    }

    @Test
    void quitCommands() {
        assertTrue(MathTex.isQuit("quit"));
        assertTrue(MathTex.isQuit("exit"));
        assertTrue(MathTex.isQuit("q"));
        assertTrue(MathTex.isQuit(":q"));
        assertFalse(MathTex.isQuit("quits"));
        assertFalse(MathTex.isQuit("q+1"));
    }
}

