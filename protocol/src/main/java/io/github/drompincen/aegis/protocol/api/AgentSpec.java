package io.github.drompincen.aegis.protocol.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity and policy rules declared for an agent at registration time.
 */
public record AgentSpec(
        String name,
        String owner,
        List<String> allows,
        List<String> blocks,
        List<String> requiresReview
) {
    public AgentSpec {
        owner = owner == null ? "" : owner;
        allows = allows == null ? List.of() : List.copyOf(allows);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        requiresReview = requiresReview == null ? List.of() : List.copyOf(requiresReview);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String owner = "";
        private final List<String> allows = new ArrayList<>();
        private final List<String> blocks = new ArrayList<>();
        private final List<String> requiresReview = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder allow(String... actions) {
            allows.addAll(List.of(actions));
            return this;
        }

        public Builder block(String... actions) {
            blocks.addAll(List.of(actions));
            return this;
        }

        public Builder review(String... actions) {
            requiresReview.addAll(List.of(actions));
            return this;
        }

        public AgentSpec build() {
            return new AgentSpec(name, owner, allows, blocks, requiresReview);
        }
    }
}
