package org.pragmatica.plc.project;

/**
 * Totals of a controller analysis.
 */
public record ParseStats(int programs,
                         int aois,
                         int routines,
                         int rungs,
                         int rungsInPrograms,
                         int rungsInAois,
                         int parsedOk,
                         int parsedErr,
                         int tagReferences,
                         int uniqueTags,
                         int stRoutines,
                         int stRoutinesInPrograms,
                         int stRoutinesInAois,
                         int stParsedOk,
                         int stParsedErr) {

    @Override
    public String toString() {
        return String.format("%d programs, %d AOIs, %d routines, %d rungs (%d ok, %d failed), "
                             + "%d ST routines (%d ok, %d failed), %d tag references to %d tags",
                             programs, aois, routines, rungs, parsedOk, parsedErr, stRoutines, stParsedOk,
                             stParsedErr, tagReferences, uniqueTags);
    }
}
