package com.phillippitts.styleswap.service.image;

import com.phillippitts.styleswap.exception.ImageDecodeException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads input images and encodes results, always working in 8-bit RGB.
 *
 * <p>Any format with an installed ImageIO reader is accepted (PNG, JPEG, BMP and GIF out of
 * the box). Alpha and palettes are flattened away on load.
 */
@Component
public class ImageCodec {

    /**
     * Loads an image as {@link BufferedImage#TYPE_INT_RGB}.
     *
     * @param path image file
     * @return decoded RGB image
     * @throws ImageDecodeException if the file is missing, unreadable or not a supported image
     */
    public BufferedImage read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new ImageDecodeException(path.toString(), "not a regular file");
        }
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException(path.toString(), e.getMessage(), e);
        }
        if (decoded == null) {
            throw new ImageDecodeException(path.toString(), "no ImageIO reader for this format");
        }
        return toRgb(decoded);
    }

    /**
     * Encodes the image as PNG.
     *
     * @throws IOException if writing fails or no PNG writer is available
     */
    public void writePng(BufferedImage image, OutputStream out) throws IOException {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(out, "out must not be null");
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No ImageIO writer available for PNG");
        }
    }

    static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = rgb.createGraphics();
        try {
            g2d.drawImage(image, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return rgb;
    }
}
