package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.expression.Expression;
import com.vidnyan.mesh.domain.expression.ReferenceCollector;
import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.SpecRule;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.EntityResolver;
import com.vidnyan.mesh.domain.spec.ExpressionSite;
import com.vidnyan.mesh.domain.spec.SpecSection;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Names used inside formulas that resolve to nothing.
 * <ul>
 *   <li>REF-006 path root or aggregation source that is not a declared entity or derived value</li>
 *   <li>REF-002 call to something that is neither a built-in nor a derived value</li>
 *   <li>LGC-003 aggregation whose source collection could not be inferred (warning)</li>
 * </ul>
 */
@Slf4j
@Component
public class ExpressionReferenceEvaluator implements SpecRule {

    public static final Set<String> BUILT_INS = Set.of(
            "today", "now", "len", "abs", "round", "floor", "ceil", "coalesce", "lower", "upper", "concat");

    private static final String ITEM_ALIAS = "item";
    private static final String RESULT_ALIAS = "result";

    @Override
    public String id() {
        return "expression-reference";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        EntityResolver resolver = EntityResolver.of(spec);
        List<ValidationError> diagnostics = new ArrayList<>();

        for (ExpressionSite site : spec.expressionSites()) {
            ReferenceCollector.References refs = ReferenceCollector.collect(site.expression());
            Set<String> reported = new HashSet<>();

            for (Expression.FieldRef ref : refs.fieldRefs()) {
                String root = ref.root();
                if (ITEM_ALIAS.equals(root) || spec.derived().containsKey(root) || resolver.isKnown(root)
                        || isFunctionInput(spec, site, root) || isScenarioResult(site, root)) {
                    continue;
                }
                if (reported.add(root)) {
                    diagnostics.add(unknownReference(site, root, "Reference '" + ref.path() + "' does not start at a declared entity", spec));
                }
            }

            for (Expression.Aggregation aggregation : refs.aggregations()) {
                if (aggregation.hasUnknownSource()) {
                    diagnostics.add(ValidationError.builder()
                            .path(site.path())
                            .code("LGC-003")
                            .category(Category.LOGIC)
                            .severity(Severity.WARNING)
                            .message("Source collection of '" + aggregation.op().wireName()
                                    + "' could not be inferred; name the collection explicitly")
                            .actual(aggregation.from())
                            .build());
                } else if (!resolver.isKnown(aggregation.from()) && reported.add(aggregation.from())) {
                    diagnostics.add(unknownReference(site, aggregation.from(),
                            "Aggregation source '" + aggregation.from() + "' is not a declared entity", spec));
                }
            }

            for (String call : refs.calls()) {
                if (!BUILT_INS.contains(call) && !spec.derived().containsKey(call)) {
                    List<String> candidates = new ArrayList<>(BUILT_INS);
                    candidates.addAll(spec.derived().keySet());
                    diagnostics.add(ValidationError.builder()
                            .path(site.path())
                            .code("REF-002")
                            .category(Category.REFERENCE)
                            .severity(Severity.ERROR)
                            .message("Unknown function '" + call + "'")
                            .actual(call)
                            .validOptions(Diagnostics.options(candidates))
                            .build());
                }
            }
        }

        log.debug("Expression reference check found {} diagnostics", diagnostics.size());
        return diagnostics;
    }

    private static boolean isFunctionInput(Specification spec, ExpressionSite site, String name) {
        return site.section() == SpecSection.FUNCTIONS
                && spec.functions().get(site.owner()).input().containsKey(name);
    }

    /**
     * Scenario assertions may inspect the outcome of the call as {@code result.x}.
     */
    private static boolean isScenarioResult(ExpressionSite site, String name) {
        return site.section() == SpecSection.SCENARIOS && RESULT_ALIAS.equals(name);
    }

    private ValidationError unknownReference(ExpressionSite site, String name, String message, Specification spec) {
        return ValidationError.builder()
                .path(site.path())
                .code("REF-006")
                .category(Category.REFERENCE)
                .severity(Severity.ERROR)
                .message(message)
                .actual(name)
                .validOptions(Diagnostics.options(spec.entities().keySet()))
                .build();
    }
}
