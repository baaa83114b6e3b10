/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.internal.info;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dev.amrwood.internal.reader.ClumpTableReader;
import dev.amrwood.internal.reader.FortranRecordReader;
import dev.amrwood.internal.reader.ShardMapping;
import dev.amrwood.internal.reader.SnapshotFiles;
import dev.amrwood.metadata.Component;
import dev.amrwood.metadata.ComponentDescriptor;
import dev.amrwood.metadata.GridInfo;
import dev.amrwood.metadata.ParticleHeader;
import dev.amrwood.metadata.SimulationInfo;
import dev.amrwood.reader.MissingDataException;
import dev.amrwood.units.BaseUnits;
import dev.amrwood.units.ScaleSet;

/**
 * Builds a {@link SimulationInfo} from the metadata files of a snapshot and the
 * headers of its first shards.
 */
public final class SimulationInfoResolver {

    private static final System.Logger LOG = System.getLogger(SimulationInfoResolver.class.getName());

    /** Adiabatic index assumed when the snapshot has no hydro files. */
    public static final double DEFAULT_GAMMA = 5.0 / 3.0;

    private SimulationInfoResolver() {
    }

    /**
     * Resolves the snapshot {@code output_XXXXX} below the given directory.
     *
     * @throws MissingDataException if the directory, the snapshot or its info file does not exist
     * @throws IOException if a metadata file is malformed
     */
    public static SimulationInfo resolve(Path baseDirectory, int output) throws IOException {
        if (output < 0) {
            throw new IllegalArgumentException("Output number must not be negative: " + output);
        }
        if (!Files.isDirectory(baseDirectory)) {
            throw new MissingDataException("Simulation directory does not exist: " + baseDirectory);
        }
        SnapshotFiles files = SnapshotFiles.of(baseDirectory, output);
        if (!Files.isDirectory(files.directory())) {
            throw new MissingDataException("Snapshot directory does not exist: " + files.directory());
        }
        if (!Files.isRegularFile(files.info())) {
            throw new MissingDataException("Info file does not exist: " + files.info());
        }

        InfoFile infoFile = InfoFileParser.parse(files.info());

        Set<Component> components = EnumSet.noneOf(Component.class);
        addIfExists(components, Component.AMR, files.amr(1));
        addIfExists(components, Component.HYDRO, files.hydro(1));
        addIfExists(components, Component.GRAVITY, files.gravity(1));
        addIfExists(components, Component.PARTICLES, files.particles(1));
        addIfExists(components, Component.CLUMPS, files.clumps(1));
        addIfExists(components, Component.RT, files.rt(1));
        addIfExists(components, Component.SINKS, files.sinks());

        GridInfo grid = components.contains(Component.AMR) ? readGrid(files.amr(1), infoFile) : GridInfo.NONE;

        int nvarh = 0;
        double gamma = DEFAULT_GAMMA;
        if (components.contains(Component.HYDRO)) {
            FortranRecordReader hydro = ShardMapping.open(files.hydro(1), Component.HYDRO);
            hydro.skipRecord();
            nvarh = hydro.readInt();
            // ndim, nlevelmax, nboundary
            hydro.skipRecords(3);
            gamma = hydro.readDouble();
        }
        ComponentDescriptor hydroDescriptor = DescriptorParser.hydro(files.hydroDescriptor(), nvarh);
        ComponentDescriptor gravityDescriptor = DescriptorParser.gravity();
        ComponentDescriptor particleDescriptor = DescriptorParser.particles(files.particleDescriptor());
        ParticleHeader particleHeader = components.contains(Component.PARTICLES)
                ? DescriptorParser.particleHeader(files.header())
                : ParticleHeader.NONE;

        ComponentDescriptor clumpDescriptor = ComponentDescriptor.absent(Component.CLUMPS);
        if (components.contains(Component.CLUMPS)) {
            List<String> header = ClumpTableReader.readHeader(files.clumps(1));
            clumpDescriptor = new ComponentDescriptor(Component.CLUMPS, 0, false, List.of(), header);
        }

        Map<String, Map<String, String>> namelist = NamelistParser.parse(files.namelist());

        BaseUnits baseUnits = BaseUnits.of(infoFile.unitL(), infoFile.unitD(), infoFile.unitT());

        SimulationInfo info = new SimulationInfo(
                output,
                baseDirectory,
                files.directory(),
                infoFile.ncpu(),
                infoFile.ndim(),
                infoFile.levelmin(),
                infoFile.levelmax(),
                infoFile.ngridmax(),
                infoFile.nstepCoarse(),
                infoFile.boxlen(),
                infoFile.time(),
                infoFile.aexp(),
                infoFile.h0(),
                infoFile.omegaM(),
                infoFile.omegaL(),
                infoFile.omegaK(),
                infoFile.omegaB(),
                baseUnits,
                infoFile.ordering(),
                infoFile.boundKeys(),
                grid,
                gamma,
                hydroDescriptor,
                gravityDescriptor,
                particleDescriptor,
                clumpDescriptor,
                particleHeader,
                namelist,
                components,
                ScaleSet.create(baseUnits));

        LOG.log(System.Logger.Level.INFO, "Resolved snapshot {0}: ncpu={1}, levels [{2}, {3}], boxlen={4}, components {5}",
                files.directory(), info.ncpu(), info.levelmin(), info.levelmax(), info.boxlen(), components);
        return info;
    }

    private static void addIfExists(Set<Component> components, Component component, Path file) {
        if (Files.isRegularFile(file)) {
            components.add(component);
        }
    }

    private static GridInfo readGrid(Path amrFile, InfoFile infoFile) throws IOException {
        FortranRecordReader amr = ShardMapping.open(amrFile, Component.AMR);
        int ncpu = amr.readInt();
        int ndim = amr.readInt();
        if (ncpu != infoFile.ncpu() || ndim != infoFile.ndim()) {
            throw new IOException("Header of " + amr.source() + " (ncpu=" + ncpu + ", ndim=" + ndim
                    + ") disagrees with the info file (ncpu=" + infoFile.ncpu() + ", ndim=" + infoFile.ndim() + ")");
        }
        int[] nxyz = amr.readInts(3);
        int nlevelmax = amr.readInt();
        int ngridmax = amr.readInt();
        int nboundary = amr.readInt();
        int ngridCurrent = amr.readInt();
        return new GridInfo(nxyz[0], nxyz[1], nxyz[2], nlevelmax, ngridmax, nboundary, ngridCurrent);
    }
}
