package com.pyast.ast;

import com.pyast.InternalConsistencyError;

/**
 * Non-owning reference to a block of the control-flow graph, by index.
 *
 * <p>Not a node: the visitor protocol never reaches it and it does not take part in the
 * ownership tree.</p>
 */
public record BlockRef(int index) {
    public BlockRef {
        if (index < 0) {
            throw new InternalConsistencyError("Negative control-flow block index " + index);
        }
    }
}
