package br.ufmg.cs.systems.wfc.io;

import br.ufmg.cs.systems.wfc.exceptions.EncodingFailureException;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes pixel buffers as image files. The destination directory must exist
 * and the destination file must not.
 */
public class ImageEncoder {
   private static final Logger LOG = Logger.getLogger(ImageEncoder.class);

   private final String defaultFormat;

   public ImageEncoder(String defaultFormat) {
      this.defaultFormat = defaultFormat;
   }

   public void write(PixelBuffer buffer, Path destination) {
      Path absolute = destination.toAbsolutePath();
      Path directory = absolute.getParent();
      if (directory == null || !Files.isDirectory(directory)) {
         throw new EncodingFailureException("directory does not exist: " + directory);
      }
      if (Files.exists(absolute)) {
         throw new EncodingFailureException("file already exists: " + absolute);
      }

      String format = StringUtils.defaultIfEmpty(
              FilenameUtils.getExtension(absolute.toString()), defaultFormat);
      if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
         throw new EncodingFailureException("no image writer for format " + format);
      }

      try (OutputStream os = Files.newOutputStream(absolute,
              StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
         encode(toBufferedImage(buffer), format, os);
      } catch (IOException e) {
         EncodingFailureException failure =
                 new EncodingFailureException("cannot write " + absolute, e);
         // no partial file left behind
         try {
            Files.deleteIfExists(absolute);
         } catch (IOException deleteFailure) {
            failure.addSuppressed(deleteFailure);
         }
         throw failure;
      }

      if (LOG.isInfoEnabled()) {
         LOG.info("Wrote image," +
                 " path=" + absolute +
                 " format=" + format +
                 " width=" + buffer.getWidth() +
                 " height=" + buffer.getHeight());
      }
   }

   protected void encode(BufferedImage image, String format, OutputStream os)
           throws IOException {
      ImageIO.write(image, format, os);
   }

   public static BufferedImage toBufferedImage(PixelBuffer buffer) {
      BufferedImage image = new BufferedImage(buffer.getWidth(),
              buffer.getHeight(), BufferedImage.TYPE_INT_RGB);
      for (int y = 0; y < buffer.getHeight(); ++y) {
         for (int x = 0; x < buffer.getWidth(); ++x) {
            image.setRGB(x, y, buffer.get(x, y));
         }
      }
      return image;
   }
}
