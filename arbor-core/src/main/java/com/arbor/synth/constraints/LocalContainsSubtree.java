package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.grammar.ContainmentProfile;
import com.arbor.synth.grammar.Grammar;
import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.RuleNode;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.Trees;
import com.arbor.synth.tree.template.PatternMatchResult;
import com.arbor.synth.tree.template.PatternMatcher;
import com.arbor.synth.tree.template.TemplateNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Requires a match of the template somewhere below {@code path}.
 *
 * <p>Candidates are the nodes where the template may still match and the
 * holes that may still grow a match deeper down. Without candidates the
 * branch is infeasible; a single candidate for a template without variables
 * receives the template's shape.
 */
public record LocalContainsSubtree(TreePath path, TemplateNode template) implements LocalConstraint {

    @Override
    public void propagate(ISolver solver) {
        Domain roots = template.rootRules();
        if (roots == null) {
            solver.deactivate(this);
            return;
        }
        AbstractRuleNode root = solver.getNodeAt(path);
        Grammar grammar = solver.getGrammar();
        SearchBudget budget = new SearchBudget(solver);
        List<ContainmentProfile> profiles = new ArrayList<>();
        for (int rule : roots.toArray()) {
            profiles.add(grammar.containment(rule));
        }

        List<TreePath> matchSites = new ArrayList<>();
        int deepSites = 0;
        for (TreePath relative : Trees.pathsInPreOrder(root)) {
            TreePath nodePath = path.resolve(relative);
            AbstractRuleNode node = solver.getNodeAt(nodePath);
            PatternMatchResult result = PatternMatcher.match(template, node, nodePath);
            if (result instanceof PatternMatchResult.Match) {
                solver.deactivate(this);
                return;
            }
            if (result instanceof PatternMatchResult.PartialMatch && canHostHere(node, nodePath, profiles, budget)) {
                matchSites.add(nodePath);
            }
            if (node instanceof Hole hole && canHostBelow(hole, nodePath, profiles, budget)) {
                deepSites++;
            }
            if (matchSites.size() + deepSites > 1) {
                return;
            }
        }

        if (matchSites.isEmpty() && deepSites == 0) {
            solver.setInfeasible();
            return;
        }
        Optional<RuleNode> shape = template.toRuleNode();
        if (deepSites == 0 && shape.isPresent()) {
            solver.makeEqual(matchSites.get(0), shape.get());
        }
    }

    private static boolean canHostHere(AbstractRuleNode node, TreePath nodePath,
                                       List<ContainmentProfile> profiles, SearchBudget budget) {
        if (!(node instanceof Hole hole)) {
            return true;
        }
        for (ContainmentProfile profile : profiles) {
            int target = profile.target();
            if (hole.domain().contains(target) && budget.fits(profile, target, nodePath, hole)) {
                return true;
            }
        }
        return false;
    }

    private static boolean canHostBelow(Hole hole, TreePath holePath,
                                        List<ContainmentProfile> profiles, SearchBudget budget) {
        for (int rule : hole.domain().toArray()) {
            for (ContainmentProfile profile : profiles) {
                if (budget.fitsBelow(profile, rule, holePath, hole)) {
                    return true;
                }
            }
        }
        return false;
    }
}
