package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.grammar.ContainmentProfile;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.Trees;

import java.util.List;

/**
 * Requires the tree rooted at {@code path} to use {@code rule}.
 *
 * <p>Satisfied for good once a filled node uses the rule. Otherwise the holes
 * that can still host it within the bounds are counted: none makes the branch
 * infeasible, exactly one is narrowed to the rules that can lead to it.
 */
public record LocalContains(TreePath path, int rule) implements LocalConstraint {

    @Override
    public void propagate(ISolver solver) {
        AbstractRuleNode root = solver.getNodeAt(path);
        if (Trees.containsRule(root, rule)) {
            solver.deactivate(this);
            return;
        }
        ContainmentProfile profile = solver.getGrammar().containment(rule);
        SearchBudget budget = new SearchBudget(solver);

        TreePath onlyHost = null;
        Domain onlyHostRules = null;
        int hosts = 0;
        List<TreePath> holes = Trees.holePaths(root);
        for (TreePath relative : holes) {
            TreePath holePath = path.resolve(relative);
            Hole hole = (Hole) solver.getNodeAt(holePath);
            Domain viable = hole.domain().filter(r -> budget.fits(profile, r, holePath, hole));
            if (!viable.isEmpty()) {
                hosts++;
                onlyHost = holePath;
                onlyHostRules = viable;
                if (hosts > 1) {
                    return;
                }
            }
        }
        if (hosts == 0) {
            solver.setInfeasible();
        } else {
            solver.removeAllBut(onlyHost, onlyHostRules);
        }
    }
}
