package vn.com.fecredit.flowable.layout.util;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

public class ModelRenderHelpersTest {

    @Test
    void transparent_pixels_become_white() throws Exception {
        BufferedImage transparent = new BufferedImage(4, 3, BufferedImage.TYPE_INT_ARGB);
        transparent.setRGB(1, 1, 0xFF000000);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageIO.write(transparent, "png", baos);

        byte[] flattened = ModelRenderHelpers.flattenOntoWhite(baos.toByteArray());

        BufferedImage out = ImageIO.read(new ByteArrayInputStream(flattened));
        assertThat(out.getColorModel().hasAlpha()).isFalse();
        assertThat(out.getWidth()).isEqualTo(4);
        assertThat(out.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0xFFFFFF);
        assertThat(out.getRGB(1, 1) & 0xFFFFFF).isEqualTo(0x000000);
    }

    @Test
    void opaque_image_is_returned_untouched() throws Exception {
        BufferedImage opaque = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageIO.write(opaque, "png", baos);
        byte[] bytes = baos.toByteArray();

        assertThat(ModelRenderHelpers.flattenOntoWhite(bytes)).isSameAs(bytes);
    }
}
