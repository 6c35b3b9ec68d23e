package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.template.PatternMatchResult;
import com.arbor.synth.tree.template.PatternMatcher;
import com.arbor.synth.tree.template.TemplateNode;

import java.util.List;

/**
 * Orders the variable bindings of one match of the template.
 */
public record LocalOrdered(TreePath path, TemplateNode template, List<String> order) implements LocalConstraint {

    @Override
    public void propagate(ISolver solver) {
        PatternMatchResult result = PatternMatcher.match(template, solver.getNodeAt(path), path);
        if (result instanceof PatternMatchResult.NoMatch) {
            solver.deactivate(this);
            return;
        }
        if (!(result instanceof PatternMatchResult.Match match)) {
            return;
        }
        boolean decided = true;
        for (int i = 0; i + 1 < order.size(); i++) {
            TreePath smaller = match.binding(order.get(i)).path();
            TreePath larger = match.binding(order.get(i + 1)).path();
            TreeOrdering.Outcome outcome = TreeOrdering.makeLessThanOrEqual(solver, smaller, larger);
            if (!solver.isFeasible()) {
                return;
            }
            switch (outcome) {
                case VIOLATED -> {
                    solver.setInfeasible();
                    return;
                }
                case UNDECIDED -> decided = false;
                case LESS, EQUAL -> {
                }
            }
        }
        if (decided) {
            solver.deactivate(this);
        }
    }
}
