package br.ufmg.cs.systems.wfc.solver;

/**
 * Counters of one solve. Attempts start at 1; every contradiction adds one.
 */
public class SolveStatistics {
   private int attempts;
   private long rounds;
   private long totalRounds;
   private long eliminations;
   private int contradictions;

   void startAttempt() {
      ++attempts;
      rounds = 0;
   }

   void addRound() {
      ++rounds;
      ++totalRounds;
   }

   void addContradiction() {
      ++contradictions;
   }

   void setEliminations(long eliminations) {
      this.eliminations = eliminations;
   }

   public int getAttempts() {
      return attempts;
   }

   /**
    * Observations in the current (or last) attempt.
    */
   public long getRounds() {
      return rounds;
   }

   public long getTotalRounds() {
      return totalRounds;
   }

   public long getEliminations() {
      return eliminations;
   }

   public int getContradictions() {
      return contradictions;
   }

   @Override
   public String toString() {
      return "SolveStatistics{" +
              "attempts=" + attempts +
              ",rounds=" + rounds +
              ",totalRounds=" + totalRounds +
              ",eliminations=" + eliminations +
              ",contradictions=" + contradictions +
              '}';
   }
}
