package org.yafin.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.yafin.image.ImageDecodeException;
import org.yafin.image.ImageIODecoder;
import org.yafin.image.ImageIOEncoder;
import org.yafin.image.PixelBuffer;
import org.yafin.image.PixelType;
import org.yafin.plugin.ImageDecoder;
import org.yafin.util.TestImageGenerator;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SingleImageNormalizerTest {

    @TempDir
    Path tempDir;

    @Mock
    private ImageDecoder failingDecoder;

    @Test
    void testNormalize_sixteenBitToPng() throws Exception {
        Path input = TestImageGenerator.writeGray16(tempDir.resolve("in.tif"), 8, 8,
                TestImageGenerator.uniformRamp(64, 0, 65535), "tiff");
        Path output = tempDir.resolve("view/out.png");

        assertTrue(new SingleImageNormalizer().normalize(input, output, 2, 98));

        PixelBuffer written = new ImageIODecoder().decode(output);
        assertEquals(PixelType.UINT8, written.type());
        assertEquals(3, written.channels());
        assertEquals(255, written.max());
    }

    @Test
    void testNormalize_eightBitInputIsStillWritten() throws Exception {
        Path input = TestImageGenerator.writeGray8(tempDir.resolve("g8.png"), 2, 1, new int[]{7, 9});
        Path output = tempDir.resolve("g8.jpg");

        assertTrue(new SingleImageNormalizer().normalize(input, output, 1, 99));
        assertTrue(Files.exists(output));
    }

    @Test
    void testNormalize_fallsBackToRgbConversion() throws Exception {
        Path input = TestImageGenerator.writeGray8(tempDir.resolve("g8.png"), 2, 1, new int[]{7, 9});
        when(failingDecoder.decode(any())).thenThrow(new ImageDecodeException("unreadable"));
        Path output = tempDir.resolve("fallback.tif");

        assertTrue(new SingleImageNormalizer(failingDecoder, new ImageIOEncoder()).normalize(input, output, 1, 99));

        PixelBuffer written = new ImageIODecoder().decode(output);
        assertArrayEquals(new int[]{1, 2, 3}, written.shape());
    }

    @Test
    void testNormalize_unreadableInput() throws Exception {
        Path input = TestImageGenerator.writeGarbage(tempDir.resolve("broken.png"));
        Path output = tempDir.resolve("broken_out.png");

        assertFalse(new SingleImageNormalizer().normalize(input, output, 1, 99));
        assertFalse(Files.exists(output));
    }

    @Test
    void testNormalize_unsupportedOutputExtension() throws Exception {
        Path input = TestImageGenerator.writeGray8(tempDir.resolve("g8.png"), 1, 1, new int[]{7});

        assertFalse(new SingleImageNormalizer().normalize(input, tempDir.resolve("out.bmp"), 1, 99));
    }
}
