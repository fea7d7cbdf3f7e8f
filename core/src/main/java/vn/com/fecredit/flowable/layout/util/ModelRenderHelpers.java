package vn.com.fecredit.flowable.layout.util;

import org.flowable.bpmn.model.BpmnModel;
import org.flowable.image.impl.DefaultProcessDiagramGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.flowable.layout.exception.DiagramRenderException;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

/**
 * PNG rendering through Flowable's process diagram generator. The generator paints on a
 * transparent canvas, so the image is flattened onto white before it is written.
 */
public final class ModelRenderHelpers {

    private static final Logger log = LoggerFactory.getLogger(ModelRenderHelpers.class);

    private static final String FONT = "Arial";

    private ModelRenderHelpers() {}

    public static Path renderToPng(BpmnModel model, Path outputFile) {
        byte[] png = renderToPng(model);
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(outputFile, png);
        } catch (IOException e) {
            throw new DiagramRenderException("Cannot write " + outputFile + ": " + e.getMessage(), e);
        }
        log.info("Wrote image: {}", outputFile.toAbsolutePath());
        return outputFile;
    }

    public static byte[] renderToPng(BpmnModel model) {
        byte[] imgBytes;
        DefaultProcessDiagramGenerator gen = new DefaultProcessDiagramGenerator();
        try (InputStream is = gen.generateDiagram(model, "png", Collections.emptyList(), Collections.emptyList(),
                FONT, FONT, FONT, ModelRenderHelpers.class.getClassLoader(), 1.0d, false)) {
            imgBytes = is.readAllBytes();
        } catch (IOException | RuntimeException e) {
            throw new DiagramRenderException("Diagram rendering failed: " + e.getMessage(), e);
        }
        if (imgBytes == null || imgBytes.length == 0) {
            throw new DiagramRenderException("Renderer returned no image bytes", null);
        }
        try {
            return flattenOntoWhite(imgBytes);
        } catch (IOException e) {
            throw new DiagramRenderException("Cannot post-process diagram image: " + e.getMessage(), e);
        }
    }

    static byte[] flattenOntoWhite(byte[] pngBytes) throws IOException {
        BufferedImage src = ImageIO.read(new ByteArrayInputStream(pngBytes));
        if (src == null || !src.getColorModel().hasAlpha()) return pngBytes;
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, out.getWidth(), out.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(out, "png", baos);
            return baos.toByteArray();
        }
    }
}
