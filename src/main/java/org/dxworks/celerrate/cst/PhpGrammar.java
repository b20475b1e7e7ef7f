package org.dxworks.celerrate.cst;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPhp;

/**
 * Entry point to the tree-sitter PHP grammar. The language object is loaded once and shared;
 * every parse gets its own parser.
 */
public final class PhpGrammar {

    private static final TSLanguage PHP;

    static {
        try {
            PHP = new TreeSitterPhp();
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize the tree-sitter PHP grammar", e);
        }
    }

    private PhpGrammar() {
    }

    /**
     * Full parse of the given source. Previous trees are never reused.
     */
    public static ConcreteNode parse(SourceText source) {
        TSParser parser = new TSParser();
        parser.setLanguage(PHP);
        TSTree tree = parser.parseString(null, source.getText());
        return TreeSitterConcreteNode.wrap(tree.getRootNode());
    }
}
