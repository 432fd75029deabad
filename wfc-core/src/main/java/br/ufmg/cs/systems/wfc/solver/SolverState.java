package br.ufmg.cs.systems.wfc.solver;

public enum SolverState {
   OBSERVING,
   PROPAGATING,
   SUCCESS,
   CONTRADICTION_RESET
}
