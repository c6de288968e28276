package com.balatro.jokers.simulation;

/**
 * Result of a single simulated run.
 *
 * @param seed         Seed the run was played with
 * @param antesCleared Antes whose boss blind was beaten
 * @param roundsWon    Blinds beaten
 * @param handsPlayed  Hands scored over the run
 * @param bestHand     Highest single-hand score
 * @param finalMoney   Wallet at the end of the run
 * @param finalJokers  Jokers still active at the end
 * @param hookErrors   Joker hooks that failed and were skipped
 */
public record SimulationResult(
    long seed,
    int antesCleared,
    int roundsWon,
    int handsPlayed,
    long bestHand,
    int finalMoney,
    int finalJokers,
    int hookErrors
) {
    /**
     * Check if the run beat every ante.
     */
    public boolean isWin() {
        return antesCleared >= SimulationEngine.FINAL_ANTE;
    }
}
