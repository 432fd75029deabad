package br.ufmg.cs.systems.wfc.pattern;

/**
 * Dihedral variants of a block: the block, its reflection, then each quarter
 * rotation followed by its reflection.
 */
public final class Symmetry {
   public static final int MAX_VARIANTS = 8;

   private Symmetry() {
   }

   /**
    * @param count number of variants wanted, in [1, 8]; the first variant is
    *              always the block itself
    */
   public static Pattern[] variants(Pattern block, int count) {
      if (count < 1 || count > MAX_VARIANTS) {
         throw new IllegalArgumentException("symmetry count must be in [1, " +
                 MAX_VARIANTS + "], got " + count);
      }

      Pattern[] all = new Pattern[MAX_VARIANTS];
      all[0] = block;
      all[1] = block.reflect();
      for (int i = 2; i < MAX_VARIANTS; i += 2) {
         all[i] = all[i - 2].rotate();
         all[i + 1] = all[i].reflect();
      }

      Pattern[] variants = new Pattern[count];
      System.arraycopy(all, 0, variants, 0, count);
      return variants;
   }
}
