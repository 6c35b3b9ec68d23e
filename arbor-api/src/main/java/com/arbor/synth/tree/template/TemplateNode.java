package com.arbor.synth.tree.template;

import com.arbor.synth.grammar.GrammarDefinition;
import com.arbor.synth.tree.Domain;
import com.arbor.synth.tree.RuleNode;
import it.unimi.dsi.fastutil.ints.Int2IntFunction;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A tree-shaped pattern used by constraints.
 *
 * <pre>{@code
 * // 1 * A, where A is any subtree
 * TemplateNode oneTimes = TemplateNode.rule(TIMES, TemplateNode.rule(ONE), TemplateNode.var("A"));
 * }</pre>
 */
public interface TemplateNode {

    List<TemplateNode> children();

    static RuleTemplate rule(int rule, TemplateNode... children) {
        return new RuleTemplate(rule, List.of(children));
    }

    static DomainTemplate anyOf(Domain rules, TemplateNode... children) {
        return new DomainTemplate(rules, List.of(children));
    }

    static VarTemplate var(String name) {
        return new VarTemplate(name);
    }

    /**
     * Rules a node must have to match this template, or {@code null} for a variable.
     */
    Domain rootRules();

    /**
     * Every rule index mentioned anywhere in the template.
     */
    default Domain referencedRules() {
        Domain rules = rootRules() == null ? Domain.empty() : rootRules();
        for (TemplateNode child : children()) {
            rules = rules.union(child.referencedRules());
        }
        return rules;
    }

    /**
     * Number of occurrences of each variable, in first-occurrence order.
     */
    default Object2IntMap<String> variableCounts() {
        Object2IntMap<String> counts = new Object2IntLinkedOpenHashMap<>();
        collectVariables(this, counts);
        return counts;
    }

    private static void collectVariables(TemplateNode node, Object2IntMap<String> counts) {
        if (node instanceof VarTemplate variable) {
            counts.put(variable.name(), counts.getInt(variable.name()) + 1);
        }
        for (TemplateNode child : node.children()) {
            collectVariables(child, counts);
        }
    }

    /**
     * The tree this template denotes when it has neither variables nor
     * rule alternatives.
     */
    default Optional<RuleNode> toRuleNode() {
        if (!(this instanceof RuleTemplate ruleTemplate)) {
            return Optional.empty();
        }
        List<RuleNode> children = new ArrayList<>();
        for (TemplateNode child : children()) {
            Optional<RuleNode> concrete = child.toRuleNode();
            if (concrete.isEmpty()) {
                return Optional.empty();
            }
            children.add(concrete.get());
        }
        return Optional.of(new RuleNode(ruleTemplate.rule(), children));
    }

    /**
     * Checks that every mentioned rule is live and has as many children as
     * the template gives it.
     */
    default boolean fits(GrammarDefinition grammar) {
        Domain rules = rootRules();
        if (rules != null) {
            for (int rule : rules.toArray()) {
                if (rule >= grammar.ruleCount() || grammar.isRemoved(rule)
                        || grammar.childTypes(rule).size() != children().size()) {
                    return false;
                }
            }
        }
        for (TemplateNode child : children()) {
            if (!child.fits(grammar)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Rewrites rule indices; the mapping returns -1 for removed rules.
     */
    Optional<TemplateNode> remap(Int2IntFunction mapping);

    static Optional<List<TemplateNode>> remapAll(List<TemplateNode> nodes, Int2IntFunction mapping) {
        List<TemplateNode> remapped = new ArrayList<>(nodes.size());
        for (TemplateNode node : nodes) {
            Optional<TemplateNode> mapped = node.remap(mapping);
            if (mapped.isEmpty()) {
                return Optional.empty();
            }
            remapped.add(mapped.get());
        }
        return Optional.of(remapped);
    }
}
