package org.truthtable.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * SEGMENTATORE - Individua i tratti di stringa fuori da ogni parentesi
 *
 * Mantiene un contatore di profondità (+1 su '(', -1 su ')'). Un tratto inizia
 * al primo carattere non di raggruppamento incontrato a profondità 0 e si chiude
 * su una '(' a profondità 0 oppure a fine stringa. Il contenuto dei gruppi non
 * compare mai nei tratti: una stringa composta da un solo gruppo non produce
 * alcun intervallo.
 *
 * La stringa deve essere già bilanciata (vedi {@link GroupingValidator}).
 */
public class UngroupedSegmenter {

    /**
     * @param text stringa bilanciata
     * @return intervalli a profondità 0, in ordine di posizione
     */
    public List<UngroupedRange> ungroupedRanges(String text) {
        List<UngroupedRange> ranges = new ArrayList<>();

        int depth = 0;
        int runStart = -1;

        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);

            if (current == OperatorTable.CLOSE_GROUP) {
                depth--;
            } else if (current == OperatorTable.OPEN_GROUP) {
                if (depth == 0 && runStart >= 0) {
                    ranges.add(new UngroupedRange(runStart, index));
                    runStart = -1;
                }
                depth++;
            } else if (depth == 0 && runStart < 0) {
                runStart = index;
            }
        }

        if (runStart >= 0) {
            ranges.add(new UngroupedRange(runStart, text.length()));
        }

        return ranges;
    }
}
