/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.metadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.amrwood.units.BaseUnits;
import dev.amrwood.units.ScaleSet;

/**
 * Immutable description of one simulation snapshot.
 * <p>
 * Created by {@link dev.amrwood.reader.Amrwood#getInfo(Path, int)} from the
 * snapshot's info, header and descriptor files. Component presence reflects
 * which shard files exist on disk.
 * </p>
 */
public record SimulationInfo(
        int output,
        Path baseDirectory,
        Path snapshotDirectory,
        int ncpu,
        int ndim,
        int levelmin,
        int levelmax,
        int ngridmax,
        int nstepCoarse,
        double boxlen,
        double time,
        double aexp,
        double h0,
        double omegaM,
        double omegaL,
        double omegaK,
        double omegaB,
        BaseUnits baseUnits,
        String ordering,
        List<Double> boundKeys,
        GridInfo grid,
        double gamma,
        ComponentDescriptor hydroDescriptor,
        ComponentDescriptor gravityDescriptor,
        ComponentDescriptor particleDescriptor,
        ComponentDescriptor clumpDescriptor,
        ParticleHeader particleHeader,
        Map<String, Map<String, String>> namelist,
        Set<Component> components,
        ScaleSet scale) {

    public SimulationInfo {
        boundKeys = List.copyOf(boundKeys);
        namelist = Map.copyOf(namelist);
        components = Set.copyOf(components);
    }

    public boolean has(Component component) {
        return components.contains(component);
    }

    public boolean amr() {
        return has(Component.AMR);
    }

    public boolean hydro() {
        return has(Component.HYDRO);
    }

    public boolean gravity() {
        return has(Component.GRAVITY);
    }

    public boolean particles() {
        return has(Component.PARTICLES);
    }

    public boolean clumps() {
        return has(Component.CLUMPS);
    }

    public boolean rt() {
        return has(Component.RT);
    }

    public boolean sinks() {
        return has(Component.SINKS);
    }

    public double unitL() {
        return baseUnits.unitL();
    }

    public double unitD() {
        return baseUnits.unitD();
    }

    public double unitT() {
        return baseUnits.unitT();
    }

    public double unitM() {
        return baseUnits.unitM();
    }

    public double unitV() {
        return baseUnits.unitV();
    }

    /**
     * Edge length of a cell at the given level, in code length units.
     */
    public double cellsize(int level) {
        return boxlen / Math.pow(2, level);
    }

    /**
     * The descriptor of a component, or an empty descriptor for components without one.
     */
    public ComponentDescriptor descriptor(Component component) {
        return switch (component) {
            case HYDRO -> hydroDescriptor;
            case GRAVITY -> gravityDescriptor;
            case PARTICLES -> particleDescriptor;
            case CLUMPS -> clumpDescriptor;
            default -> ComponentDescriptor.absent(component);
        };
    }

    /**
     * Column names of the stored variables of a component, in file order.
     */
    public List<String> variables(Component component) {
        return descriptor(component).variables();
    }
}
