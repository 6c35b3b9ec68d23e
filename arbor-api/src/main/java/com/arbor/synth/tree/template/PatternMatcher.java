package com.arbor.synth.tree.template;

import com.arbor.synth.tree.AbstractRuleNode;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.Hole;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.template.PatternMatchResult.Binding;
import com.arbor.synth.tree.template.PatternMatchResult.HoleRequirement;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches templates against partial trees without modifying them.
 *
 * <p>A hole that could take one of the template's rules is reported as a
 * {@link HoleRequirement}. Repeated variables compare their bound subtrees:
 * a position where both are filled with different rules, or where a hole
 * cannot take the other side's rule, rules the match out. A hole facing a
 * leaf becomes a requirement; anything else involving holes leaves the
 * result inexact.
 */
public final class PatternMatcher {

    private enum Status { MATCHING, FAILED }

    private final Object2IntMap<String> variableCounts;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final List<HoleRequirement> requirements = new ArrayList<>();
    private boolean exact = true;

    private PatternMatcher(TemplateNode template) {
        this.variableCounts = template.variableCounts();
    }

    /**
     * Matches {@code template} against {@code node}, which sits at {@code path}
     * of the enclosing tree. Requirement and binding paths are absolute.
     */
    public static PatternMatchResult match(TemplateNode template, AbstractRuleNode node, TreePath path) {
        PatternMatcher matcher = new PatternMatcher(template);
        if (matcher.matchNode(template, node, path) == Status.FAILED) {
            return PatternMatchResult.NO_MATCH;
        }
        if (matcher.requirements.isEmpty() && matcher.exact) {
            return new PatternMatchResult.Match(matcher.bindings);
        }
        return new PatternMatchResult.PartialMatch(matcher.requirements, matcher.exact);
    }

    public static PatternMatchResult match(TemplateNode template, AbstractRuleNode root) {
        return match(template, root, TreePath.ROOT);
    }

    private Status matchNode(TemplateNode template, AbstractRuleNode node, TreePath path) {
        if (template instanceof VarTemplate variable) {
            Binding previous = bindings.get(variable.name());
            if (previous == null) {
                bindings.put(variable.name(), new Binding(path, node));
                return Status.MATCHING;
            }
            return compare(previous.node(), previous.path(), node, path);
        }

        Domain rules = template.rootRules();
        if (node instanceof Hole hole) {
            Domain possible = hole.domain().intersect(rules);
            if (possible.isEmpty()) {
                return Status.FAILED;
            }
            requirements.add(new HoleRequirement(path, possible));
            if (!onlyFreeVariables(template.children())) {
                exact = false;
            }
            return Status.MATCHING;
        }

        if (!rules.contains(node.rule()) || node.children().size() != template.children().size()) {
            return Status.FAILED;
        }
        for (int i = 0; i < template.children().size(); i++) {
            if (matchNode(template.children().get(i), node.children().get(i), path.child(i)) == Status.FAILED) {
                return Status.FAILED;
            }
        }
        return Status.MATCHING;
    }

    private boolean onlyFreeVariables(List<TemplateNode> children) {
        for (TemplateNode child : children) {
            if (!(child instanceof VarTemplate variable) || variableCounts.getInt(variable.name()) > 1) {
                return false;
            }
        }
        return true;
    }

    private Status compare(AbstractRuleNode a, TreePath pathA, AbstractRuleNode b, TreePath pathB) {
        if (a instanceof Hole holeA && b instanceof Hole holeB) {
            if (!holeA.domain().intersects(holeB.domain())) {
                return Status.FAILED;
            }
            exact = false;
            return Status.MATCHING;
        }
        if (a instanceof Hole holeA) {
            return requireRule(holeA, pathA, b);
        }
        if (b instanceof Hole holeB) {
            return requireRule(holeB, pathB, a);
        }
        if (a.rule() != b.rule() || a.children().size() != b.children().size()) {
            return Status.FAILED;
        }
        for (int i = 0; i < a.children().size(); i++) {
            if (compare(a.children().get(i), pathA.child(i), b.children().get(i), pathB.child(i)) == Status.FAILED) {
                return Status.FAILED;
            }
        }
        return Status.MATCHING;
    }

    private Status requireRule(Hole hole, TreePath holePath, AbstractRuleNode filled) {
        if (!hole.domain().contains(filled.rule())) {
            return Status.FAILED;
        }
        requirements.add(new HoleRequirement(holePath, Domain.of(filled.rule())));
        if (!filled.children().isEmpty()) {
            exact = false;
        }
        return Status.MATCHING;
    }
}
