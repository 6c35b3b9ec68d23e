package com.arbor.synth.grammar;

import com.arbor.synth.api.exceptions.ConstraintDomainException;
import com.arbor.synth.api.exceptions.GrammarStructureException;
import com.arbor.synth.constraint.GrammarConstraint;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Mutable authoring model of a grammar: rules, declared categories and the
 * constraints attached to them.
 *
 * <p>Rule indices are stable. Removing a rule leaves a tombstone; only
 * {@link #compact()} re-indexes. Compile with an
 * {@link com.arbor.synth.api.IGrammarCompiler} before searching.
 *
 * <pre>{@code
 * GrammarDefinition grammar = new GrammarDefinition();
 * int one = grammar.addRule("Int", "1");
 * int plus = grammar.addRule("Int", "{0} + {1}", "Int", "Int");
 * grammar.addConstraint(new Forbidden(TemplateNode.rule(plus, TemplateNode.var("A"), TemplateNode.var("A"))));
 * }</pre>
 */
public final class GrammarDefinition {

    private static final Logger logger = Logger.getLogger(GrammarDefinition.class.getName());

    private final List<Rule> rules = new ArrayList<>();
    private final Set<String> declaredCategories = new LinkedHashSet<>();
    private final List<GrammarConstraint> constraints = new ArrayList<>();

    /**
     * Declares a category so that rules can refer to it before it has rules.
     */
    public void declareCategory(String category) {
        declaredCategories.add(checkCategory(category));
    }

    public int addRule(String category, List<String> childTypes) {
        return addRule(category, childTypes, null, 1.0);
    }

    public int addRule(String category, String label, String... childTypes) {
        return addRule(category, List.of(childTypes), label, 1.0);
    }

    /**
     * Appends a rule.
     *
     * @return index of the new rule
     * @throws GrammarStructureException if a child category is unknown
     */
    public int addRule(String category, List<String> childTypes, String label, double weight) {
        checkCategory(category);
        for (String childType : childTypes) {
            checkCategory(childType);
            if (!childType.equals(category) && !isKnownCategory(childType)) {
                throw new GrammarStructureException(String.format(
                        "Rule '%s' of category '%s' refers to unknown category '%s'",
                        label, category, childType));
            }
        }
        int index = rules.size();
        rules.add(new Rule(index, category, childTypes, label, weight, false));
        return index;
    }

    private boolean isKnownCategory(String category) {
        if (declaredCategories.contains(category)) {
            return true;
        }
        for (Rule rule : rules) {
            if (!rule.removed() && rule.returnType().equals(category)) {
                return true;
            }
        }
        return false;
    }

    private static String checkCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new GrammarStructureException("Category name must not be blank");
        }
        return category;
    }

    /**
     * Removes a rule, keeping its index as a tombstone.
     */
    public void removeRule(int index) {
        Rule rule = checkedRule(index);
        if (!rule.removed()) {
            rules.set(index, rule.asRemoved());
        }
    }

    /**
     * Re-indexes the live rules densely and rewrites every attached
     * constraint. Constraints that only made sense for removed rules are
     * dropped.
     *
     * @return old index to new index, for live rules only
     */
    public Int2IntMap compact() {
        Int2IntMap mapping = new Int2IntOpenHashMap();
        mapping.defaultReturnValue(-1);
        List<Rule> live = new ArrayList<>();
        for (Rule rule : rules) {
            if (!rule.removed()) {
                mapping.put(rule.index(), live.size());
                live.add(rule.withIndex(live.size()));
            }
        }
        rules.clear();
        rules.addAll(live);

        List<GrammarConstraint> remapped = new ArrayList<>();
        for (GrammarConstraint constraint : constraints) {
            Optional<GrammarConstraint> rewritten = constraint.remap(mapping);
            if (rewritten.isPresent()) {
                remapped.add(rewritten.get());
            } else {
                logger.warning("Dropping constraint " + constraint + ": it refers to removed rules");
            }
        }
        constraints.clear();
        constraints.addAll(remapped);
        return mapping;
    }

    /**
     * Attaches a constraint.
     *
     * @return false if an equivalent constraint is already attached
     * @throws ConstraintDomainException if the constraint refers to rules this grammar lacks
     */
    public boolean addConstraint(GrammarConstraint constraint) {
        if (!constraint.isDomainValid(this)) {
            throw new ConstraintDomainException(
                    "Constraint " + constraint + " refers to rules outside of the grammar (" + rules.size() + " rules)");
        }
        for (GrammarConstraint existing : constraints) {
            if (existing.isSame(constraint)) {
                logger.fine("Skipping duplicate constraint " + constraint);
                return false;
            }
        }
        constraints.add(constraint);
        return true;
    }

    public void clearConstraints() {
        constraints.clear();
    }

    public List<GrammarConstraint> constraints() {
        return Collections.unmodifiableList(constraints);
    }

    /**
     * Live rules of a category in ascending index order.
     */
    public IntList rulesFor(String category) {
        IntList result = new IntArrayList();
        for (Rule rule : rules) {
            if (!rule.removed() && rule.returnType().equals(category)) {
                result.add(rule.index());
            }
        }
        return result;
    }

    /**
     * Declared categories followed by the return types of live rules, in
     * first-appearance order.
     */
    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>(declaredCategories);
        for (Rule rule : rules) {
            if (!rule.removed()) {
                categories.add(rule.returnType());
            }
        }
        return Collections.unmodifiableSet(categories);
    }

    public Set<String> declaredCategories() {
        return Collections.unmodifiableSet(declaredCategories);
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public Rule rule(int index) {
        return checkedRule(index);
    }

    public int ruleCount() {
        return rules.size();
    }

    public boolean isRemoved(int index) {
        return checkedRule(index).removed();
    }

    public boolean isTerminal(int index) {
        return checkedRule(index).isTerminal();
    }

    public List<String> childTypes(int index) {
        return checkedRule(index).childTypes();
    }

    private Rule checkedRule(int index) {
        if (index < 0 || index >= rules.size()) {
            throw new GrammarStructureException("Unknown rule index " + index + " (grammar has " + rules.size() + " rules)");
        }
        return rules.get(index);
    }
}
