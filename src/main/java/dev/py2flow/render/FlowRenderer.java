package dev.py2flow.render;

import dev.py2flow.model.Flow;

/**
 * Turns a flow into a diagram document.
 */
public interface FlowRenderer {

    RenderFormat format();

    /**
     * @throws dev.py2flow.engine.CycleDetectedException when the format is
     *         layered and the flow has a cycle
     */
    String render(Flow flow);
}
