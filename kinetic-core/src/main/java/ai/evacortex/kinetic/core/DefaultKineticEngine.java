/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core;

import ai.evacortex.kinetic.core.cap.CapGenerator;
import ai.evacortex.kinetic.core.cap.CapProperties;
import ai.evacortex.kinetic.core.cap.CapVariant;
import ai.evacortex.kinetic.core.cap.CapVerifier;
import ai.evacortex.kinetic.core.config.EngineConfig;
import ai.evacortex.kinetic.core.geometry.GeometryTables;
import ai.evacortex.kinetic.core.geometry.MirrorAxis;
import ai.evacortex.kinetic.core.letter.Classification;
import ai.evacortex.kinetic.core.letter.LetterClassifier;
import ai.evacortex.kinetic.core.letter.ReferenceDataset;
import ai.evacortex.kinetic.core.metadata.OverrideKeys;
import ai.evacortex.kinetic.core.metadata.OverrideScope;
import ai.evacortex.kinetic.core.metadata.PrefloatOverrideStore;
import ai.evacortex.kinetic.core.model.*;
import ai.evacortex.kinetic.core.orientation.ConcreteMotion;
import ai.evacortex.kinetic.core.orientation.OrientationCalculator;
import ai.evacortex.kinetic.core.orientation.PrefloatResolver;
import ai.evacortex.kinetic.core.placement.ArrowLocationResolver;
import ai.evacortex.kinetic.core.placement.ArrowPlacement;
import ai.evacortex.kinetic.core.placement.DefaultPlacements;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class DefaultKineticEngine implements KineticEngine, Closeable {

    private static final Logger log = LoggerFactory.getLogger(DefaultKineticEngine.class);

    private final PrefloatOverrideStore store;
    private final PrefloatResolver prefloatResolver;
    private final ArrowLocationResolver locationResolver;
    private final LetterClassifier classifier;
    private final CapGenerator generator;
    private final CapVerifier verifier;

    public DefaultKineticEngine(ReferenceDataset dataset) {
        this(EngineConfig.fromSystemProperties(), dataset);
    }

    public DefaultKineticEngine(EngineConfig config, ReferenceDataset dataset) {
        this(PrefloatOverrideStore.loadOrCreate(config), dataset, DefaultPlacements.fromClasspath(),
                config.mirrorAxis());
    }

    public DefaultKineticEngine(PrefloatOverrideStore store, ReferenceDataset dataset,
                                DefaultPlacements placements, MirrorAxis defaultAxis) {
        this.store = Objects.requireNonNull(store, "store");
        this.prefloatResolver = new PrefloatResolver(store);
        this.locationResolver = new ArrowLocationResolver(prefloatResolver, placements);
        this.classifier = new LetterClassifier(dataset, prefloatResolver);
        this.generator = new CapGenerator(prefloatResolver, defaultAxis);
        this.verifier = new CapVerifier(generator);
        log.info("Kinetic engine ready: {} letter templates, overrides at {}", dataset.size(),
                store.file() == null ? "<memory>" : store.file());
    }

    @Override
    public Orientation calculateEndOrientation(Beat beat, Color color) {
        return OrientationCalculator.calculateEndOrientation(beat, color, prefloatResolver);
    }

    @Override
    public ConcreteMotion resolveEffectiveMotion(Beat beat, Color color) {
        return prefloatResolver.resolve(beat, color);
    }

    @Override
    public Location resolveArrowLocation(Beat beat, Color color) {
        return locationResolver.resolveLocation(beat, color);
    }

    @Override
    public ArrowPlacement resolveArrowPlacement(Beat beat, Color color) {
        return locationResolver.resolvePlacement(beat, color);
    }

    @Override
    public Classification classify(Beat beat) {
        return classifier.classify(beat);
    }

    @Override
    public Beat applyEdit(Beat beat, Color color, MotionAttributes edited) {
        Beat updated = beat.withMotion(color, edited.withEndOri(null));
        updated = new Beat(updated.beatNumber(), updated.letter(), updated.letterType(),
                GeometryTables.combine(updated.blue().startLoc(), updated.red().startLoc()),
                GeometryTables.combine(updated.blue().endLoc(), updated.red().endLoc()),
                updated.timing(), updated.direction(), updated.blue(), updated.red());
        updated = classifier.assignLetter(updated);
        if (updated.letter() == null) {
            log.debug("Beat {} no longer matches a letter after {} edit", updated.beatNumber(), color.wireName());
        }
        for (Color c : Color.values()) {
            MotionAttributes motion = updated.motion(c);
            updated = updated.withMotion(c, motion.withEndOri(calculateEndOrientation(updated, c)));
        }
        return updated;
    }

    @Override
    public Sequence generateCap(Sequence partial, int targetLength, CapVariant variant) {
        return generator.generate(partial, targetLength, variant);
    }

    @Override
    public Sequence generateCap(Sequence partial, int targetLength, CapVariant variant, MirrorAxis axis) {
        return generator.generate(partial, targetLength, variant, axis);
    }

    @Override
    public CapProperties classifyCap(Sequence sequence) {
        return verifier.classifyCap(sequence);
    }

    @Override
    public void recordPrefloat(Beat beat, Color color, MotionType motionType, RotationDirection propRotDir) {
        if ((motionType != MotionType.PRO && motionType != MotionType.ANTI) || !propRotDir.isRotating()) {
            throw new IllegalArgumentException("Prefloat must be pro/anti with a rotation, got "
                    + motionType + "/" + propRotDir);
        }
        Map<String, JsonNode> values = new LinkedHashMap<>();
        values.put(OverrideKeys.prefloatMotionType(color), TextNode.valueOf(motionType.wireName()));
        values.put(OverrideKeys.prefloatPropRotDir(color), TextNode.valueOf(propRotDir.wireName()));
        store.putAll(requireScope(beat), values);
    }

    @Override
    public void pinArrowLocation(Beat beat, Color color, Location location) {
        MotionAttributes motion = beat.motion(color);
        store.putText(requireScope(beat), OverrideKeys.locationOverride(motion.startLoc(), motion.endLoc()),
                location.wireName());
    }

    @Override
    public boolean toggleRotationOverride(Beat beat, Color color) {
        return store.toggle(requireScope(beat), OverrideKeys.rotAngleOverride(color));
    }

    @Override
    public PrefloatOverrideStore overrides() {
        return store;
    }

    @Override
    public void close() {
        store.flush();
    }

    private static OverrideScope requireScope(Beat beat) {
        OverrideScope scope = OverrideScope.forBeat(beat);
        if (scope == null) {
            throw new IllegalArgumentException("Beat " + beat.beatNumber()
                    + " needs a letter and start orientations to carry overrides");
        }
        return scope;
    }
}
