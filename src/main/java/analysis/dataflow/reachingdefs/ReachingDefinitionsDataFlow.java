package analysis.dataflow.reachingdefs;

import ir.cfg.CFGNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import analysis.dataflow.DataFlow;
import analysis.dataflow.util.SetAbsVal;

/**
 * Forward "may" analysis computing, for each program point, the definitions that may reach it without an intervening
 * redefinition of the same variable.
 * <p>
 * A node kills every definition of the variables it defines and generates one new definition for each of them.
 */
public class ReachingDefinitionsDataFlow extends DataFlow<SetAbsVal<Definition>> {

    public ReachingDefinitionsDataFlow() {
        super(true);
    }

    @Override
    protected SetAbsVal<Definition> bottom() {
        return SetAbsVal.empty();
    }

    @Override
    protected SetAbsVal<Definition> flow(SetAbsVal<Definition> reaching, CFGNode current) {
        Set<String> defs = current.getDefs();
        if (defs.isEmpty()) {
            return reaching;
        }

        List<Definition> killed = new ArrayList<>();
        for (Definition d : reaching) {
            if (defs.contains(d.getVariable())) {
                killed.add(d);
            }
        }
        List<Definition> generated = new ArrayList<>(defs.size());
        for (String v : defs) {
            generated.add(new Definition(v, current));
        }
        return reaching.minus(killed).plus(generated);
    }
}
