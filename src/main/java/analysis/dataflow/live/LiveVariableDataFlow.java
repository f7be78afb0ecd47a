package analysis.dataflow.live;

import ir.cfg.CFGNode;
import analysis.dataflow.DataFlow;
import analysis.dataflow.util.SetAbsVal;

/**
 * Backward "may" analysis computing the variables that may be read before being overwritten on some path from each
 * program point.
 * <p>
 * The fact before a node is <code>(after - defs) + uses</code>; the fact after a node is the union of the facts
 * before its successors. Nothing is live at the exit.
 */
public class LiveVariableDataFlow extends DataFlow<SetAbsVal<String>> {

    public LiveVariableDataFlow() {
        super(false);
    }

    @Override
    protected SetAbsVal<String> bottom() {
        return SetAbsVal.empty();
    }

    @Override
    protected SetAbsVal<String> flow(SetAbsVal<String> liveAfter, CFGNode current) {
        return liveAfter.minus(current.getDefs()).plus(current.getUses());
    }
}
