package vn.com.fecredit.flowable.layout.util;

import vn.com.fecredit.flowable.layout.engine.LayoutEngine;
import vn.com.fecredit.flowable.layout.engine.LayoutSettings;
import vn.com.fecredit.flowable.layout.exception.FlowLayoutException;
import vn.com.fecredit.flowable.layout.model.FlowDocument;
import vn.com.fecredit.flowable.layout.service.FlowDocumentReader;
import vn.com.fecredit.flowable.layout.service.FlowLayoutService;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line front end: lays out a flow JSON file and writes BPMN, SVG and Mermaid
 * next to it (or into {@code --out-dir}).
 *
 * <pre>
 * FlowDiagramTool &lt;flow.json&gt; [--out-dir DIR] [--validate] [--png] [--set key=value]...
 * </pre>
 *
 * Exit status is 0 on success, 1 for usage or input errors and 2 when validation fails.
 */
public class FlowDiagramTool {

    static final int OK = 0;
    static final int USAGE_ERROR = 1;
    static final int VALIDATION_FAILED = 2;

    private static final String USAGE =
            "Usage: FlowDiagramTool <flow.json> [--out-dir DIR] [--validate] [--png] [--set key=value]...";

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != OK) System.exit(status);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return USAGE_ERROR;
        }
        Path in = null;
        Path outDir = null;
        boolean validate = false;
        boolean png = false;
        LayoutSettings settings = LayoutSettings.defaults();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--out-dir".equals(arg) && i + 1 < args.length) {
                outDir = Path.of(args[++i]);
            } else if ("--validate".equals(arg)) {
                validate = true;
            } else if ("--png".equals(arg)) {
                png = true;
            } else if ("--set".equals(arg) && i + 1 < args.length) {
                try {
                    settings = applySetting(settings, args[++i]);
                } catch (IllegalArgumentException e) {
                    err.println("Invalid --set " + args[i] + ": " + e.getMessage());
                    return USAGE_ERROR;
                }
            } else if (arg.startsWith("--") || in != null) {
                err.println("Unexpected argument: " + arg);
                err.println(USAGE);
                return USAGE_ERROR;
            } else {
                in = Path.of(arg);
            }
        }
        if (in == null) {
            err.println(USAGE);
            return USAGE_ERROR;
        }
        if (!Files.isRegularFile(in)) {
            err.println("Input file not found: " + in);
            return USAGE_ERROR;
        }
        if (outDir == null) {
            outDir = in.toAbsolutePath().getParent();
        }

        FlowLayoutService service = new FlowLayoutService(new LayoutEngine(settings), new FlowDocumentReader());
        String baseName = in.getFileName().toString().replaceAll("(?i)\\.json$", "");
        try {
            FlowDocument doc = service.read(in);
            Files.createDirectories(outDir);

            String bpmn = service.toBpmnXml(doc);
            Path bpmnFile = write(outDir.resolve(baseName + ".bpmn"), bpmn);
            out.println("Wrote BPMN: " + bpmnFile.toAbsolutePath());
            out.println("Wrote SVG: " + write(outDir.resolve(baseName + ".svg"), service.toSvg(doc)).toAbsolutePath());
            out.println("Wrote Mermaid: " + write(outDir.resolve(baseName + ".mmd"), service.toMermaid(doc)).toAbsolutePath());

            if (validate) {
                ValidationResult vr = service.validateBpmn(bpmn);
                out.println("Validation: " + (vr.valid ? "OK" : "FAILED"));
                vr.messages().forEach(m -> out.println(" - " + m));
                if (!vr.valid) return VALIDATION_FAILED;
            }
            if (png) {
                Path written = service.renderPng(doc, outDir.resolve(baseName + ".png"));
                out.println("Wrote image: " + written.toAbsolutePath());
            }
            return OK;
        } catch (FlowLayoutException e) {
            err.println("Error: " + e.getMessage());
            return USAGE_ERROR;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return USAGE_ERROR;
        }
    }

    static LayoutSettings applySetting(LayoutSettings settings, String assignment) {
        int eq = assignment.indexOf('=');
        if (eq <= 0 || eq == assignment.length() - 1) {
            throw new IllegalArgumentException("expected key=value");
        }
        String key = assignment.substring(0, eq).trim();
        if (key.startsWith("flow.layout.")) key = key.substring("flow.layout.".length());
        double value;
        try {
            value = Double.parseDouble(assignment.substring(eq + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("value is not a number");
        }
        return settings.with(key, value);
    }

    private static Path write(Path file, String content) throws IOException {
        return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }
}
