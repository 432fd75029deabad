package br.ufmg.cs.systems.wfc.io;

import br.ufmg.cs.systems.wfc.exceptions.InvalidInputException;

import java.util.Arrays;

/**
 * Row-major grid of packed 0xRRGGBB colors.
 */
public class PixelBuffer {
   private final int width;
   private final int height;
   private final int[] pixels;

   public PixelBuffer(int width, int height) {
      this(width, height, new int[checkedArea(width, height)]);
   }

   public PixelBuffer(int width, int height, int[] pixels) {
      int area = checkedArea(width, height);
      if (pixels.length != area) {
         throw new InvalidInputException("pixel buffer of " + width + "x" +
                 height + " needs " + area + " pixels, got " + pixels.length);
      }
      this.width = width;
      this.height = height;
      this.pixels = pixels;
   }

   private static int checkedArea(int width, int height) {
      if (width < 1 || height < 1) {
         throw new InvalidInputException("image must have at least one pixel, got " +
                 width + "x" + height);
      }
      return Math.multiplyExact(width, height);
   }

   public int getWidth() {
      return width;
   }

   public int getHeight() {
      return height;
   }

   public int get(int x, int y) {
      return pixels[y * width + x];
   }

   /**
    * Toroidal read, coordinates wrap around both edges.
    */
   public int getWrapped(int x, int y) {
      return get(Math.floorMod(x, width), Math.floorMod(y, height));
   }

   public void set(int x, int y, int rgb) {
      pixels[y * width + x] = rgb & 0xFFFFFF;
   }

   public int[] getPixels() {
      return pixels;
   }

   public int countDistinctColors() {
      return (int) Arrays.stream(pixels).distinct().count();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      PixelBuffer that = (PixelBuffer) o;
      return width == that.width && height == that.height &&
              Arrays.equals(pixels, that.pixels);
   }

   @Override
   public int hashCode() {
      return 31 * (31 * width + height) + Arrays.hashCode(pixels);
   }

   @Override
   public String toString() {
      return "PixelBuffer(" + width + "x" + height + ")";
   }
}
