package org.truthtable.parser;

import org.truthtable.exception.UnbalancedGroupingException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Verifica che le parentesi di una (sotto)stringa siano bilanciate.
 *
 * Scansione da sinistra a destra con una pila di aperture pendenti: una ')' con
 * pila vuota fallisce subito (NO_OPENING), una pila non vuota a fine scansione
 * fallisce con NO_CLOSING.
 */
public class GroupingValidator {

    /**
     * @param text stringa da controllare
     * @throws UnbalancedGroupingException se le parentesi non sono bilanciate
     */
    public void validate(String text) throws UnbalancedGroupingException {
        Deque<Integer> pending = new ArrayDeque<>();

        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);

            if (current == OperatorTable.OPEN_GROUP) {
                pending.push(index);
            } else if (current == OperatorTable.CLOSE_GROUP) {
                if (pending.isEmpty()) {
                    throw new UnbalancedGroupingException(UnbalancedGroupingException.Kind.NO_OPENING, text);
                }
                pending.pop();
            }
        }

        if (!pending.isEmpty()) {
            throw new UnbalancedGroupingException(UnbalancedGroupingException.Kind.NO_CLOSING, text);
        }
    }

    /**
     * @return true se la stringa supera {@link #validate(String)}
     */
    public boolean isBalanced(String text) {
        try {
            validate(text);
            return true;
        } catch (UnbalancedGroupingException e) {
            return false;
        }
    }
}
