package org.truthtable.parser;

import org.truthtable.formula.FormulaNode;

/**
 * Operatori binari riconosciuti dal parser, con simbolo, tipo di nodo prodotto e
 * livello di split.
 *
 * Il livello indica l'ordine in cui il parser cerca gli operatori: il livello 1
 * viene cercato per primo e diventa la radice dell'albero, quindi lega meno di
 * tutti. A parità di livello vince l'occorrenza più a sinistra.
 */
public enum BinaryOperator {

    IMPLIES('→', FormulaNode.Type.IMPLIES, 1),
    EQUALS('=', FormulaNode.Type.EQUALS, 1),
    NOT_EQUALS('≠', FormulaNode.Type.NOT_EQUALS, 1),
    OR('∨', FormulaNode.Type.OR, 2),
    XOR('⊕', FormulaNode.Type.XOR, 2),
    AND('∧', FormulaNode.Type.AND, 3);

    private final char symbol;
    private final FormulaNode.Type nodeType;
    private final int level;

    BinaryOperator(char symbol, FormulaNode.Type nodeType, int level) {
        this.symbol = symbol;
        this.nodeType = nodeType;
        this.level = level;
    }

    public char getSymbol() {
        return symbol;
    }

    public FormulaNode.Type getNodeType() {
        return nodeType;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Costruisce il nodo binario corrispondente all'operatore.
     */
    public FormulaNode create(FormulaNode left, FormulaNode right) {
        return FormulaNode.binary(nodeType, left, right);
    }
}
