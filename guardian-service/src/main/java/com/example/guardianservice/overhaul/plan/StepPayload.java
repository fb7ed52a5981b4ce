package com.example.guardianservice.overhaul.plan;

import com.example.guardianservice.overhaul.model.CategoryTemplate;
import com.example.guardianservice.overhaul.model.FeatureFlag;
import com.example.guardianservice.overhaul.model.IdentitySettings;
import com.example.guardianservice.overhaul.model.RoleTemplate;
import com.example.guardianservice.overhaul.model.TierTemplate;

import java.util.List;

/**
 * Operation-specific parameters of a {@link Step}.
 */
public interface StepPayload {

    record Settings(IdentitySettings identity) implements StepPayload {
    }

    record RoleCreation(List<RoleTemplate> roles) implements StepPayload {
        public RoleCreation {
            roles = List.copyOf(roles);
        }
    }

    /**
     * @param roleNames every declared role, highest first
     */
    record RoleOrder(List<String> roleNames) implements StepPayload {
        public RoleOrder {
            roleNames = List.copyOf(roleNames);
        }
    }

    /**
     * @param roles role templates consulted when deriving overwrites (staff visibility)
     * @param tiers tier templates consulted when deriving posting restrictions
     */
    record Structure(List<CategoryTemplate> categories, List<RoleTemplate> roles,
                     List<TierTemplate> tiers) implements StepPayload {
        public Structure {
            categories = List.copyOf(categories);
            roles = List.copyOf(roles);
            tiers = List.copyOf(tiers);
        }
    }

    record LevelingSetup(List<TierTemplate> tiers) implements StepPayload {
        public LevelingSetup {
            tiers = List.copyOf(tiers);
        }
    }

    /**
     * @param layout extra categories and channels the module owns; empty for modules that only
     *               publish content
     */
    record ModuleSetup(FeatureFlag feature, Structure layout) implements StepPayload {
    }

    /**
     * @param expected every category and channel the run should have left behind
     */
    record Finalize(List<CategoryTemplate> expected) implements StepPayload {
        public Finalize {
            expected = List.copyOf(expected);
        }
    }
}
