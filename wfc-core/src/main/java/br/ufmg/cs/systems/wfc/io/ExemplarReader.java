package br.ufmg.cs.systems.wfc.io;

import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;
import org.apache.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes an exemplar image into RGB pixels. Alpha is dropped.
 */
public class ExemplarReader {
   private static final Logger LOG = Logger.getLogger(ExemplarReader.class);

   public PixelBuffer read(Path path) {
      if (path == null || !Files.isRegularFile(path)) {
         throw new InvalidInputException("exemplar not found: " + path);
      }

      long start = 0;
      if (LOG.isInfoEnabled()) {
         start = System.currentTimeMillis();
         LOG.info("Reading exemplar, path=" + path);
      }

      PixelBuffer buffer;
      try (InputStream is = Files.newInputStream(path)) {
         buffer = read(is, path.toString());
      } catch (IOException e) {
         throw new InvalidInputException("unreadable exemplar " + path, e);
      }

      if (LOG.isInfoEnabled()) {
         LOG.info("Done reading exemplar," +
                 " path=" + path +
                 " width=" + buffer.getWidth() +
                 " height=" + buffer.getHeight() +
                 " colors=" + buffer.countDistinctColors() +
                 " elapsed=" + (System.currentTimeMillis() - start) + " ms");
      }

      return buffer;
   }

   public PixelBuffer read(InputStream is, String name) throws IOException {
      BufferedImage image = ImageIO.read(is);
      if (image == null) {
         throw new InvalidInputException("no image decoder for " + name);
      }
      return toPixelBuffer(image);
   }

   public static PixelBuffer toPixelBuffer(BufferedImage image) {
      int width = image.getWidth();
      int height = image.getHeight();
      PixelBuffer buffer = new PixelBuffer(width, height);
      for (int y = 0; y < height; ++y) {
         for (int x = 0; x < width; ++x) {
            buffer.set(x, y, image.getRGB(x, y));
         }
      }
      return buffer;
   }
}
