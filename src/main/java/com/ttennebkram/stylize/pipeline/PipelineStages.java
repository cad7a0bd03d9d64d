package com.ttennebkram.stylize.pipeline;

import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.stages.AestheticRefiner;
import com.ttennebkram.stylize.stages.CoherenceReconciler;
import com.ttennebkram.stylize.stages.Compositor;
import com.ttennebkram.stylize.stages.FaceAnalyzer;
import com.ttennebkram.stylize.stages.FlowGenerator;
import com.ttennebkram.stylize.stages.MaterialSimulator;
import com.ttennebkram.stylize.stages.Stage;

/**
 * The fixed set of stages a pipeline runs, one per role.
 * Immutable; the {@code withX} methods return a copy with one role replaced.
 */
public final class PipelineStages {

    private final Stage analyzer;
    private final Stage flow;
    private final Stage material;
    private final Stage compositor;
    private final Stage reconciler;
    private final Stage refiner;

    public PipelineStages(Stage analyzer, Stage flow, Stage material,
                          Stage compositor, Stage reconciler, Stage refiner) {
        this.analyzer = requireStage(analyzer, "analyzer");
        this.flow = requireStage(flow, "flow");
        this.material = requireStage(material, "material");
        this.compositor = requireStage(compositor, "compositor");
        this.reconciler = requireStage(reconciler, "reconciler");
        this.refiner = requireStage(refiner, "refiner");
    }

    /**
     * The built-in stages for a configuration.
     */
    public static PipelineStages defaults(Configuration configuration) {
        return new PipelineStages(
                new FaceAnalyzer(configuration),
                new FlowGenerator(configuration),
                new MaterialSimulator(configuration),
                new Compositor(configuration),
                new CoherenceReconciler(configuration),
                new AestheticRefiner(configuration));
    }

    private static Stage requireStage(Stage stage, String role) {
        if (stage == null) {
            throw new IllegalArgumentException("The " + role + " stage must not be null");
        }
        return stage;
    }

    public Stage getAnalyzer() { return analyzer; }
    public Stage getFlow() { return flow; }
    public Stage getMaterial() { return material; }
    public Stage getCompositor() { return compositor; }
    public Stage getReconciler() { return reconciler; }
    public Stage getRefiner() { return refiner; }

    public PipelineStages withAnalyzer(Stage stage) {
        return new PipelineStages(stage, flow, material, compositor, reconciler, refiner);
    }

    public PipelineStages withFlow(Stage stage) {
        return new PipelineStages(analyzer, stage, material, compositor, reconciler, refiner);
    }

    public PipelineStages withMaterial(Stage stage) {
        return new PipelineStages(analyzer, flow, stage, compositor, reconciler, refiner);
    }

    public PipelineStages withCompositor(Stage stage) {
        return new PipelineStages(analyzer, flow, material, stage, reconciler, refiner);
    }

    public PipelineStages withReconciler(Stage stage) {
        return new PipelineStages(analyzer, flow, material, compositor, stage, refiner);
    }

    public PipelineStages withRefiner(Stage stage) {
        return new PipelineStages(analyzer, flow, material, compositor, reconciler, stage);
    }
}
