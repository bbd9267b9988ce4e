/*
 * KineticEngine — Beat Notation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.kinetic.core.metadata;

import ai.evacortex.kinetic.core.model.Color;
import ai.evacortex.kinetic.core.model.Location;

/**
 * Leaf keys stored under an {@link OverrideScope}.
 */
public final class OverrideKeys {

    private OverrideKeys() {}

    public static String prefloatMotionType(Color color) {
        return color.wireName() + "_prefloat_motion_type";
    }

    public static String prefloatPropRotDir(Color color) {
        return color.wireName() + "_prefloat_prop_rot_dir";
    }

    /** {@code [x, y]} offset replacing the default placement adjustment. */
    public static String adjustment(Color color) {
        return color.wireName() + "_adjustment";
    }

    /** Boolean flag toggled from the graph editor. */
    public static String rotAngleOverride(Color color) {
        return color.wireName() + "_rot_angle_override";
    }

    /** Manual anchor for a shift arrow between two locations. */
    public static String locationOverride(Location start, Location end) {
        return "loc_override_" + start.wireName() + "_" + end.wireName();
    }
}
