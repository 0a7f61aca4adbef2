package net.grammarkit.grammar;

/**
 * The ways in which TreeTransformer reduces a parse tree node.
 */
public enum TagKind {
    LITERAL,      // Meta-character; see MetaCharacter
    TERMINAL,     // Concatenated into a single Terminal
    NON_TERMINAL, // Concatenated into a single NonTerminal
    PRODUCTION,   // Symbols assembled into a Production
    START_SYMBOL, // One NonTerminal wrapped into a Production
    STRUCTURAL    // Container node; children returned as a list
}
