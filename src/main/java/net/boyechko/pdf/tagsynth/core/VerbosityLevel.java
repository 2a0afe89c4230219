/*
 * PDF-TagSynth - Accessibility Structure-Tree Synthesis
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.tagsynth.core;

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only errors and final status
 *   <li>NORMAL - Summary information (default)
 *   <li>VERBOSE - Per-page progress and the synthesized tree
 *   <li>DEBUG - All information including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    /** Only show errors and final status */
    QUIET(0),

    /** Show summary information (default) */
    NORMAL(1),

    /** Show per-page progress and the synthesized tree */
    VERBOSE(2),

    /** Show all information including debug logs */
    DEBUG(3);

    private final int level;

    VerbosityLevel(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Check if this verbosity level is at least as verbose as the specified level.
     *
     * @param other the level to compare against
     * @return true if this level is at least as verbose as other
     */
    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
