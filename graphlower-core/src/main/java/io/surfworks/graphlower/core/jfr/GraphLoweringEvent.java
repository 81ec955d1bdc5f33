package io.surfworks.graphlower.core.jfr;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording one phase of lowering a graph.
 *
 * <p>Usage:
 * <pre>{@code
 * GraphLoweringEvent event = new GraphLoweringEvent();
 * event.begin();
 * // ... lower ...
 * event.graphName = "forward";
 * event.phase = "run";
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.graphlower.GraphLowering")
@Label("Graph Lowering")
@Category({"GraphLower", "Lowering"})
@Description("Records a graph lowering phase and the size of the resulting IR")
public class GraphLoweringEvent extends Event {

    @Label("Graph Name")
    @Description("Name of the traced graph")
    public String graphName;

    @Label("Phase")
    @Description("Lowering phase: run, codegen, compile")
    public String phase;

    @Label("Node Count")
    @Description("Number of nodes in the traced graph")
    public int nodeCount;

    @Label("Buffer Count")
    @Description("Number of buffers registered so far")
    public int bufferCount;

    @Label("Layout Optimization")
    @Description("Whether channels-last layout optimization is active")
    public boolean layoutOptimization;

    @Label("Channels-Last Convolutions")
    @Description("Number of convolutions lowered with a channels-last output")
    public int channelsLastConvs;
}
