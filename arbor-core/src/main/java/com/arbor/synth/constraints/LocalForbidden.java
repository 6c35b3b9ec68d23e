package com.arbor.synth.constraints;

import com.arbor.synth.api.ISolver;
import com.arbor.synth.constraint.LocalConstraint;
import com.arbor.synth.tree.TreePath;
import com.arbor.synth.tree.template.PatternMatchResult;
import com.arbor.synth.tree.template.PatternMatchResult.HoleRequirement;
import com.arbor.synth.tree.template.PatternMatcher;
import com.arbor.synth.tree.template.TemplateNode;

/**
 * Forbids a match of the template at one position.
 */
public record LocalForbidden(TreePath path, TemplateNode template) implements LocalConstraint {

    @Override
    public void propagate(ISolver solver) {
        PatternMatchResult result = PatternMatcher.match(template, solver.getNodeAt(path), path);
        if (result instanceof PatternMatchResult.NoMatch) {
            solver.deactivate(this);
        } else if (result instanceof PatternMatchResult.Match) {
            solver.setInfeasible();
        } else if (result instanceof PatternMatchResult.PartialMatch partial
                && partial.exact() && partial.requirements().size() == 1) {
            // the last hole decides the match: keep it away from the matching rules
            HoleRequirement requirement = partial.requirements().get(0);
            solver.deactivate(this);
            solver.remove(requirement.path(), requirement.rules());
        }
    }
}
