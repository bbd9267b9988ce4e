/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.model;

/**
 * Second-level key of the override store, derived from both props' start orientations.
 */
public enum OrientationCategory {
    FROM_LAYER1("from_layer1"),
    FROM_LAYER2("from_layer2"),
    FROM_LAYER3_BLUE1_RED2("from_layer3_blue1_red2"),
    FROM_LAYER3_BLUE2_RED1("from_layer3_blue2_red1");

    private final String key;

    OrientationCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static OrientationCategory of(Orientation blueStart, Orientation redStart) {
        boolean blueRadial = blueStart.isRadial();
        boolean redRadial = redStart.isRadial();
        if (blueRadial && redRadial) return FROM_LAYER1;
        if (!blueRadial && !redRadial) return FROM_LAYER2;
        return blueRadial ? FROM_LAYER3_BLUE1_RED2 : FROM_LAYER3_BLUE2_RED1;
    }
}
