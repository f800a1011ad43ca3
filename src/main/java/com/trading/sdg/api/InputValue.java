package com.trading.sdg.api;

/**
 * A value wired into a node input: either a reference to another node's output
 * or an inline constant.
 */
public interface InputValue {

    boolean isReference();

    /** Canonical string form, {@code "<node_id>#<handle>"} for references. */
    String canonical();

    static NodeReference ref(String nodeId, String handle) {
        return new NodeReference(nodeId, handle);
    }

    static Literal literal(Constant value) {
        return new Literal(value);
    }

    /** Points at a named output of another node. */
    record NodeReference(String nodeId, String handle) implements InputValue {
        public NodeReference {
            if (nodeId == null || nodeId.isEmpty())
                throw new IllegalArgumentException("Node reference needs a node id");
            if (handle == null || handle.isEmpty())
                throw new IllegalArgumentException("Node reference needs a handle");
        }

        /** Parses {@code "<node_id>#<handle>"}. */
        public static NodeReference parse(String ref) {
            int idx = ref.lastIndexOf('#');
            if (idx <= 0 || idx == ref.length() - 1)
                throw new IllegalArgumentException("Invalid node reference: '" + ref + "'");
            return new NodeReference(ref.substring(0, idx), ref.substring(idx + 1));
        }

        public NodeReference withNodeId(String newId) {
            return new NodeReference(newId, handle);
        }

        @Override
        public boolean isReference() {
            return true;
        }

        @Override
        public String canonical() {
            return nodeId + "#" + handle;
        }

        @Override
        public String toString() {
            return canonical();
        }
    }

    /** Inline typed constant. */
    record Literal(Constant value) implements InputValue {
        @Override
        public boolean isReference() {
            return false;
        }

        @Override
        public String canonical() {
            return value.canonical();
        }

        @Override
        public String toString() {
            return canonical();
        }
    }
}
