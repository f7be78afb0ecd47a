package analysis.pointer.registrar;

import ir.cfg.CFGNode;

/**
 * A statement whose effect on the heap the points-to analysis does not model. Results computed in the presence of
 * one of these are approximate.
 */
public final class UnsupportedConstruct {

    private final CFGNode node;
    private final String reason;

    public UnsupportedConstruct(CFGNode node, String reason) {
        assert node != null;
        this.node = node;
        this.reason = reason == null ? "unsupported construct" : reason;
    }

    /**
     * @return CFG node of the offending statement
     */
    public CFGNode getNode() {
        return node;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return node.getName() + " (" + node.getStatement().getText() + "): " + reason;
    }
}
