package com.aramcoach.core.nodes;

import com.aramcoach.core.engine.FactsUnavailableException;
import com.aramcoach.core.facts.FactLoader;
import com.aramcoach.core.model.FactSet;
import com.aramcoach.core.model.RunPhase;
import com.aramcoach.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * INIT → FACTS_LOADED. Any loader failure ends the run.
 */
@Component
public class LoadFactsNode {

    private static final Logger log = LoggerFactory.getLogger(LoadFactsNode.class);

    private final FactLoader factLoader;

    public LoadFactsNode(FactLoader factLoader) {
        this.factLoader = factLoader;
    }

    public void apply(RunState state) {
        String patchId = state.request().patchId();
        FactSet facts;
        try {
            facts = factLoader.load(patchId);
        } catch (RuntimeException e) {
            throw new FactsUnavailableException(patchId,
                    "Facts for patch " + patchId + " are unavailable: " + e.getMessage(), e);
        }
        log.debug("Loaded {} champions, {} items for patch {}",
                facts.champions().size(), facts.items().size(), patchId);
        state.setFacts(facts);
        state.transitionTo(RunPhase.FACTS_LOADED);
    }
}
