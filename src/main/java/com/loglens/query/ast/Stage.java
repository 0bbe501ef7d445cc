package com.loglens.query.ast;

/**
 * One command of the pipeline. Instances are immutable.
 */
public abstract class Stage {

    private final int index;

    protected Stage(int index) {
        this.index = index;
    }

    /**
     * Position of the stage in the pipeline, starting at 0.
     */
    public int getIndex() {
        return index;
    }

    public abstract StageKind getKind();
}
