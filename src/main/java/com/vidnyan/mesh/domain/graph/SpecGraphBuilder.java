package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.domain.expression.Confidence;
import com.vidnyan.mesh.domain.expression.Expression;
import com.vidnyan.mesh.domain.expression.ReferenceCollector;
import com.vidnyan.mesh.domain.spec.*;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a specification and the AST of every embedded formula, producing nodes
 * and edges. Edges whose target is not a declared element are dropped.
 */
@Slf4j
final class SpecGraphBuilder {

    private static final String ITEM_ALIAS = "item";

    private final Specification spec;
    private final EntityResolver resolver;
    private final Map<NodeId, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<GraphEdge.Key, GraphEdge> edges = new LinkedHashMap<>();
    private int dropped;

    SpecGraphBuilder(Specification spec) {
        this.spec = spec;
        this.resolver = EntityResolver.of(spec);
    }

    SpecGraph build() {
        addNodes();

        spec.entities().forEach(this::linkEntity);
        spec.derived().forEach(this::linkDerived);
        spec.functions().forEach(this::linkFunction);
        spec.scenarios().forEach(this::linkScenario);
        spec.invariants().forEach(this::linkInvariant);
        spec.stateMachines().forEach(this::linkStateMachine);
        spec.roles().forEach(this::linkRole);
        spec.events().forEach(this::linkEvent);
        spec.subscriptions().forEach(this::linkSubscription);
        spec.sagas().forEach(this::linkSaga);
        spec.gateways().forEach(this::linkGateway);
        spec.deadlines().forEach(this::linkDeadline);
        spec.schedules().forEach(this::linkSchedule);
        spec.constraints().forEach(this::linkConstraint);

        log.debug("Built spec graph: {} nodes, {} edges ({} dropped with undeclared targets)",
                nodes.size(), edges.size(), dropped);
        return new SpecGraph(nodes, edges);
    }

    private void addNodes() {
        spec.entities().forEach((name, entity) -> {
            addNode(NodeKind.ENTITY, name, entity);
            entity.fields().forEach((field, def) -> addNode(NodeId.field(name, field), def));
        });
        spec.derived().forEach((name, def) -> addNode(NodeKind.DERIVED, name, def));
        spec.functions().forEach((name, def) -> addNode(NodeKind.FUNCTION, name, def));
        spec.scenarios().forEach((name, def) -> addNode(NodeKind.SCENARIO, name, def));
        spec.invariants().forEach((name, def) -> addNode(NodeKind.INVARIANT, name, def));
        spec.stateMachines().forEach((name, def) -> addNode(NodeKind.STATE_MACHINE, name, def));
        spec.roles().forEach((name, def) -> addNode(NodeKind.ROLE, name, def));
        spec.events().forEach((name, def) -> addNode(NodeKind.EVENT, name, def));
        spec.subscriptions().forEach((name, def) -> addNode(NodeKind.SUBSCRIPTION, name, def));
        spec.sagas().forEach((name, def) -> addNode(NodeKind.SAGA, name, def));
        spec.gateways().forEach((name, def) -> addNode(NodeKind.GATEWAY, name, def));
        spec.deadlines().forEach((name, def) -> addNode(NodeKind.DEADLINE, name, def));
        spec.schedules().forEach((name, def) -> addNode(NodeKind.SCHEDULE, name, def));
        spec.constraints().forEach((name, def) -> addNode(NodeKind.CONSTRAINT, name, def));
    }

    private void linkEntity(String name, EntityDefinition entity) {
        NodeId entityId = NodeId.of(NodeKind.ENTITY, name);
        entity.fields().forEach((fieldName, field) -> {
            NodeId fieldId = NodeId.field(name, fieldName);
            addEdge(fieldId, entityId, EdgeRelation.BELONGS_TO, Confidence.EXPLICIT);
            resolver.resolveReference(fieldName, field).ifPresent(target ->
                    addEdge(fieldId, NodeId.of(NodeKind.ENTITY, target.entity()),
                            EdgeRelation.REFERENCES, target.confidence()));
        });
    }

    private void linkDerived(String name, DerivedDefinition def) {
        NodeId id = NodeId.of(NodeKind.DERIVED, name);
        if (def.entity() != null) {
            addEdge(id, NodeId.of(NodeKind.ENTITY, def.entity()), EdgeRelation.DEPENDS_ON, Confidence.EXPLICIT);
        }
        linkExpression(id, def.formula(), def.entity(), EdgeRelation.DERIVES_FROM);
    }

    private void linkFunction(String name, FunctionDefinition fn) {
        NodeId id = NodeId.of(NodeKind.FUNCTION, name);
        fn.input().forEach((inputName, field) -> resolver.resolveReference(inputName, field).ifPresent(target ->
                addEdge(id, NodeId.of(NodeKind.ENTITY, target.entity()), EdgeRelation.REFERENCES, target.confidence())));

        fn.pre().forEach(expr -> linkExpression(id, expr, null, EdgeRelation.REFERENCES));
        fn.error().forEach(err -> linkExpression(id, err.when(), null, EdgeRelation.REFERENCES));

        for (PostAction action : fn.post()) {
            linkExpression(id, action.condition(), null, EdgeRelation.REFERENCES);
            action.values().values().forEach(value -> linkExpression(id, value, action.target(), EdgeRelation.REFERENCES));
            switch (action.kind()) {
                case CREATE -> linkEntityTarget(id, action.target(), EdgeRelation.CREATES);
                case UPDATE -> linkEntityTarget(id, action.target(), EdgeRelation.MODIFIES);
                case DELETE -> linkEntityTarget(id, action.target(), EdgeRelation.DELETES);
                case EMIT -> addEdge(id, NodeId.of(NodeKind.EVENT, action.target()), EdgeRelation.TRIGGERS, Confidence.EXPLICIT);
                case CALL -> addEdge(id, NodeId.of(NodeKind.FUNCTION, action.target()), EdgeRelation.TRIGGERS, Confidence.EXPLICIT);
            }
        }
    }

    private void linkScenario(String name, Scenario scenario) {
        NodeId id = NodeId.of(NodeKind.SCENARIO, name);
        if (scenario.call() != null) {
            addEdge(id, NodeId.of(NodeKind.FUNCTION, scenario.call()), EdgeRelation.REFERENCES, Confidence.EXPLICIT);
        }
        scenario.given().keySet().forEach(entity -> linkEntityTarget(id, entity, EdgeRelation.REFERENCES));
        scenario.assertions().forEach(expr -> linkExpression(id, expr, null, EdgeRelation.REFERENCES));
    }

    private void linkInvariant(String name, Invariant invariant) {
        NodeId id = NodeId.of(NodeKind.INVARIANT, name);
        linkEntityTarget(id, invariant.entity(), EdgeRelation.DEPENDS_ON);
        linkExpression(id, invariant.expr(), invariant.entity(), EdgeRelation.REFERENCES);
    }

    private void linkStateMachine(String name, StateMachine sm) {
        NodeId id = NodeId.of(NodeKind.STATE_MACHINE, name);
        linkEntityTarget(id, sm.entity(), EdgeRelation.DEPENDS_ON);
        if (sm.entity() != null && sm.field() != null) {
            addEdge(id, NodeId.field(sm.entity(), sm.field()), EdgeRelation.REFERENCES, Confidence.EXPLICIT);
        }
        for (StateMachine.Transition transition : sm.transitions()) {
            if (transition.trigger() != null) {
                NodeId function = NodeId.of(NodeKind.FUNCTION, transition.trigger());
                NodeId event = NodeId.of(NodeKind.EVENT, transition.trigger());
                addEdge(id, nodes.containsKey(function) ? function : event, EdgeRelation.TRIGGERS, Confidence.EXPLICIT);
            }
            linkExpression(id, transition.guard(), sm.entity(), EdgeRelation.REFERENCES);
        }
    }

    private void linkRole(String name, Role role) {
        NodeId id = NodeId.of(NodeKind.ROLE, name);
        role.inherits().forEach(parent ->
                addEdge(id, NodeId.of(NodeKind.ROLE, parent), EdgeRelation.DEPENDS_ON, Confidence.EXPLICIT));
        role.entityPermissions().forEach(permission ->
                linkEntityTarget(id, permission.entity(), EdgeRelation.REFERENCES));
    }

    private void linkEvent(String name, EventDefinition event) {
        NodeId id = NodeId.of(NodeKind.EVENT, name);
        event.payload().forEach((fieldName, field) -> resolver.resolveReference(fieldName, field).ifPresent(target ->
                addEdge(id, NodeId.of(NodeKind.ENTITY, target.entity()), EdgeRelation.REFERENCES, target.confidence())));
    }

    private void linkSubscription(String name, Subscription subscription) {
        NodeId id = NodeId.of(NodeKind.SUBSCRIPTION, name);
        if (subscription.event() != null) {
            addEdge(id, NodeId.of(NodeKind.EVENT, subscription.event()), EdgeRelation.DEPENDS_ON, Confidence.EXPLICIT);
        }
        linkFunctionTarget(id, subscription.handler());
    }

    private void linkSaga(String name, Saga saga) {
        NodeId id = NodeId.of(NodeKind.SAGA, name);
        for (Saga.SagaStep step : saga.steps()) {
            linkFunctionTarget(id, step.action());
            linkFunctionTarget(id, step.compensation());
        }
    }

    private void linkGateway(String name, Gateway gateway) {
        NodeId id = NodeId.of(NodeKind.GATEWAY, name);
        for (Gateway.GatewayFlow flow : gateway.flows()) {
            linkFunctionTarget(id, flow.target());
            linkExpression(id, flow.condition(), null, EdgeRelation.REFERENCES);
        }
    }

    private void linkDeadline(String name, Deadline deadline) {
        NodeId id = NodeId.of(NodeKind.DEADLINE, name);
        linkEntityTarget(id, deadline.entity(), EdgeRelation.DEPENDS_ON);
        linkFunctionTarget(id, deadline.action());
        if (deadline.escalationEvent() != null) {
            addEdge(id, NodeId.of(NodeKind.EVENT, deadline.escalationEvent()), EdgeRelation.TRIGGERS, Confidence.EXPLICIT);
        }
    }

    private void linkSchedule(String name, Schedule schedule) {
        linkFunctionTarget(NodeId.of(NodeKind.SCHEDULE, name), schedule.action());
    }

    private void linkConstraint(String name, Constraint constraint) {
        NodeId id = NodeId.of(NodeKind.CONSTRAINT, name);
        linkEntityTarget(id, constraint.entity(), EdgeRelation.DEPENDS_ON);
        if (constraint.entity() != null) {
            constraint.fields().forEach(field ->
                    addEdge(id, NodeId.field(constraint.entity(), field), EdgeRelation.REFERENCES, Confidence.EXPLICIT));
        }
    }

    /**
     * Edges for every name an expression mentions. {@code selfEntity} resolves
     * {@code self.x} and may be null.
     */
    private void linkExpression(NodeId owner, Expression expression, String selfEntity, EdgeRelation relation) {
        if (expression == null) {
            return;
        }
        ReferenceCollector.References refs = ReferenceCollector.collect(expression);

        for (Expression.FieldRef ref : refs.fieldRefs()) {
            String root = ref.root();
            if (ITEM_ALIAS.equals(root)) {
                continue;
            }
            NodeId derived = NodeId.of(NodeKind.DERIVED, root);
            if (nodes.containsKey(derived) && ref.field().isEmpty()) {
                addEdge(owner, derived, relation, Confidence.EXPLICIT);
                continue;
            }
            resolver.resolve(root).ifPresent(target -> {
                addEdge(owner, NodeId.of(NodeKind.ENTITY, target.entity()), relation, target.confidence());
                ref.field().ifPresent(field ->
                        addEdge(owner, NodeId.field(target.entity(), field), relation, target.confidence()));
            });
        }

        for (String field : refs.selfFields()) {
            NodeId derived = NodeId.of(NodeKind.DERIVED, field);
            if (selfEntity != null && nodes.containsKey(NodeId.field(selfEntity, field))) {
                addEdge(owner, NodeId.field(selfEntity, field), relation, Confidence.EXPLICIT);
            } else if (nodes.containsKey(derived)) {
                addEdge(owner, derived, relation, Confidence.EXPLICIT);
            }
        }

        for (String input : refs.inputs()) {
            NodeId derived = NodeId.of(NodeKind.DERIVED, input);
            if (nodes.containsKey(derived)) {
                addEdge(owner, derived, relation, Confidence.EXPLICIT);
            }
        }

        for (String call : refs.calls()) {
            NodeId derived = NodeId.of(NodeKind.DERIVED, call);
            if (nodes.containsKey(derived)) {
                addEdge(owner, derived, relation, Confidence.EXPLICIT);
            }
        }

        for (Expression.Aggregation aggregation : refs.aggregations()) {
            if (aggregation.hasUnknownSource()) {
                continue;
            }
            resolver.resolve(aggregation.from()).ifPresent(target -> {
                Confidence confidence = aggregation.sourceConfidence() == Confidence.INFERRED
                        ? Confidence.INFERRED : target.confidence();
                addEdge(owner, NodeId.of(NodeKind.ENTITY, target.entity()), relation, confidence);
            });
        }
    }

    private void linkEntityTarget(NodeId owner, String entity, EdgeRelation relation) {
        Optional.ofNullable(entity)
                .flatMap(resolver::resolve)
                .ifPresent(target ->
                        addEdge(owner, NodeId.of(NodeKind.ENTITY, target.entity()), relation, target.confidence()));
    }

    private void linkFunctionTarget(NodeId owner, String function) {
        if (function != null) {
            addEdge(owner, NodeId.of(NodeKind.FUNCTION, function), EdgeRelation.TRIGGERS, Confidence.EXPLICIT);
        }
    }

    private void addNode(NodeKind kind, String name, Object definition) {
        addNode(NodeId.of(kind, name), definition);
    }

    private void addNode(NodeId id, Object definition) {
        nodes.putIfAbsent(id, new GraphNode(id, definition));
    }

    /**
     * Adds an edge unless its target is undeclared. A repeated (from, to, relation)
     * triple keeps the strongest confidence seen.
     */
    private void addEdge(NodeId from, NodeId to, EdgeRelation relation, Confidence confidence) {
        if (!nodes.containsKey(to)) {
            dropped++;
            return;
        }
        GraphEdge edge = new GraphEdge(from, to, relation, confidence);
        edges.merge(edge.key(), edge, (existing, added) ->
                existing.confidence() == Confidence.EXPLICIT ? existing : added);
    }
}
