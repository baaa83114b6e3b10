/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.testing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Writes a small two-shard snapshot with the layout of a RAMSES output.
 * <p>
 * The octree has one grid on level 1 whose first and last cells are refined into one
 * level-2 grid each, leaving 6 + 16 leaf cells that fill the box. Shard 1 owns the
 * level-1 grid and the first level-2 grid and also carries the second level-2 grid as
 * a ghost of domain 2; shard 2 carries the level-1 grid as a ghost and owns the second
 * level-2 grid. Cell values follow {@link #hydroValue} and {@link #gravityValue}.
 * </p>
 */
public final class SnapshotWriter {

    public static final int OUTPUT = 42;
    public static final int NCPU = 2;
    public static final int LEVELMIN = 1;
    public static final int LEVELMAX = 2;
    public static final double BOXLEN = 100.0;
    public static final double TIME = 0.330855641315456;
    public static final double UNIT_L = 3.085677581e21;
    public static final double UNIT_D = 6.767e-23;
    public static final double UNIT_T = 4.70e14;
    public static final double GAMMA = 1.4;
    public static final int HYDRO_VARIABLES = 6;
    public static final int LEAF_CELLS = 22;

    private static final int NGRIDMAX = 100;

    private static final Grid ROOT = new Grid(1, 1, 1, new double[]{ 0.5, 0.5, 0.5 }, new int[]{ 2, 0, 0, 0, 0, 0, 0, 3 });
    private static final Grid LOWER = new Grid(2, 2, 1, new double[]{ 0.25, 0.25, 0.25 }, new int[8]);
    private static final Grid UPPER = new Grid(2, 3, 2, new double[]{ 0.75, 0.75, 0.75 }, new int[8]);
    private static final List<Grid> GRIDS = List.of(ROOT, LOWER, UPPER);

    /** Added to particle ids written as 8-byte integers, so they do not fit an int. */
    public static final long LONG_ID_OFFSET = 1L << 40;

    /** Particles of both shards; positions and velocities in code units. */
    public static final List<Particle> PARTICLES = List.of(
            new Particle(1, 1, 10, 20, 30, 1, 0, 0, 1e-3, (byte) 1, 0.0),
            new Particle(1, 2, 50, 50, 50, 0, 1, 0, 2e-3, (byte) 2, 0.1),
            new Particle(1, 3, 90, 10, 70, 0, 0, 0, 0.0, (byte) 0, 0.0),
            new Particle(2, 4, 25, 75, 5, 0, 0, 1, 3e-3, (byte) 2, 0.2),
            new Particle(2, 5, 60, 40, 95, -1, 0, 0, 4e-3, (byte) 1, 0.0));

    private static final List<String> CLUMP_COLUMNS = List.of(
            "index", "lev", "parent", "ncell", "peak_x", "peak_y", "peak_z", "rho-", "rho+", "rho_av", "mass_cl",
            "relevance");

    public record Grid(int level, int index, int domain, double[] center, int[] son) {
    }

    public record Particle(int cpu, int id, double x, double y, double z, double vx, double vy, double vz,
                           double mass, byte family, double birth) {
    }

    private final Path baseDirectory;
    private boolean hydro = true;
    private boolean gravity = true;
    private boolean particles = true;
    private boolean clumps;
    private boolean sinks;
    private boolean hydroDescriptor = true;
    private int particleVersion = 1;
    private boolean longIds;

    private SnapshotWriter(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public static SnapshotWriter in(Path baseDirectory) {
        return new SnapshotWriter(baseDirectory);
    }

    public SnapshotWriter hydro(boolean hydro) {
        this.hydro = hydro;
        return this;
    }

    public SnapshotWriter gravity(boolean gravity) {
        this.gravity = gravity;
        return this;
    }

    public SnapshotWriter particles(boolean particles) {
        this.particles = particles;
        return this;
    }

    public SnapshotWriter clumps(boolean clumps) {
        this.clumps = clumps;
        return this;
    }

    public SnapshotWriter sinks(boolean sinks) {
        this.sinks = sinks;
        return this;
    }

    public SnapshotWriter hydroDescriptor(boolean hydroDescriptor) {
        this.hydroDescriptor = hydroDescriptor;
        return this;
    }

    /**
     * Writes particle ids as 8-byte integers, offset by {@link #LONG_ID_OFFSET}.
     */
    public SnapshotWriter longIds(boolean longIds) {
        this.longIds = longIds;
        return this;
    }

    /**
     * Particle layout: 0 without family and tag records, 1 with them and a descriptor file.
     */
    public SnapshotWriter particleVersion(int particleVersion) {
        this.particleVersion = particleVersion;
        return this;
    }

    /**
     * Writes the snapshot and returns the simulation base directory.
     */
    public Path write() throws IOException {
        Path directory = snapshotDirectory(baseDirectory);
        Files.createDirectories(directory);
        writeLines(directory.resolve("info_" + pad(OUTPUT) + ".txt"), infoLines());
        writeLines(directory.resolve("namelist.txt"), List.of(
                "&RUN_PARAMS", "hydro=.true.", "poisson=.true.", "ncpu=" + NCPU, "/",
                "&AMR_PARAMS", "levelmin=" + LEVELMIN, "levelmax=" + LEVELMAX, "boxlen=100.0", "/"));
        for (int icpu = 1; icpu <= NCPU; icpu++) {
            amrFile(icpu).writeTo(shard(directory, "amr", icpu));
            if (hydro) {
                cellFile(icpu, true).writeTo(shard(directory, "hydro", icpu));
            }
            if (gravity) {
                cellFile(icpu, false).writeTo(shard(directory, "grav", icpu));
            }
            if (particles) {
                particleFile(icpu).writeTo(shard(directory, "part", icpu));
            }
            if (clumps) {
                writeLines(directory.resolve("clump_" + pad(OUTPUT) + ".txt" + pad(icpu)), clumpLines(icpu));
            }
        }
        if (hydro && hydroDescriptor) {
            writeLines(directory.resolve("hydro_file_descriptor.txt"), List.of(
                    "# version:  1",
                    "# ivar, variable_name, variable_type",
                    "  1, density, d",
                    "  2, velocity_x, d",
                    "  3, velocity_y, d",
                    "  4, velocity_z, d",
                    "  5, pressure, d",
                    "  6, scalar_01, d"));
        }
        if (particles) {
            writeLines(directory.resolve("header_" + pad(OUTPUT) + ".txt"), headerLines());
            if (particleVersion > 0) {
                writeLines(directory.resolve("part_file_descriptor.txt"), List.of(
                        "# version:  1",
                        "# ivar, variable_name, variable_type",
                        "  1, position_x, d",
                        "  2, position_y, d",
                        "  3, position_z, d",
                        "  4, velocity_x, d",
                        "  5, velocity_y, d",
                        "  6, velocity_z, d",
                        "  7, mass, d",
                        "  8, identity, i",
                        "  9, levelp, i",
                        " 10, family, b",
                        " 11, tag, b",
                        " 12, birth_time, d"));
            }
        }
        if (sinks) {
            writeLines(directory.resolve("sink_" + pad(OUTPUT) + ".csv"), List.of(" # id,msink,x,y,z"));
        }
        return baseDirectory;
    }

    public static Path snapshotDirectory(Path baseDirectory) {
        return baseDirectory.resolve("output_" + pad(OUTPUT));
    }

    public static Path shard(Path directory, String prefix, int icpu) {
        return directory.resolve(prefix + "_" + pad(OUTPUT) + ".out" + pad(icpu));
    }

    // ==================== Cell content ====================

    public static double hydroValue(int ivar, int level, int cx, int cy, int cz) {
        double rho = 1.0 + level + 0.1 * (cx + cy + cz);
        return switch (ivar) {
            case 0 -> rho;
            case 1 -> 0.1 * cx;
            case 2 -> -0.2 * cy;
            case 3 -> 0.05 * cz;
            case 4 -> 0.5 * rho;
            default -> 0.01 * level;
        };
    }

    public static double gravityValue(int ivar, int level, int cx, int cy, int cz) {
        return switch (ivar) {
            case 0 -> -1.0 / level - 0.01 * cx;
            case 1 -> -0.1 * cx;
            case 2 -> -0.1 * cy;
            default -> -0.1 * cz;
        };
    }

    /**
     * {@code {level, cx, cy, cz}} of every leaf cell of the full octree.
     */
    public static List<int[]> leafCells() {
        return leafCells(LEVELMAX);
    }

    /**
     * Leaf cells when the tree is cut at {@code lmax}: refined cells on level {@code lmax} count as leaves.
     */
    public static List<int[]> leafCells(int lmax) {
        List<int[]> leaves = new ArrayList<>();
        for (Grid grid : GRIDS) {
            if (grid.level() > lmax) {
                continue;
            }
            for (int ind = 0; ind < 8; ind++) {
                if (grid.son()[ind] == 0 || grid.level() == lmax) {
                    int[] index = cellIndex(grid, ind);
                    leaves.add(new int[]{ grid.level(), index[0], index[1], index[2] });
                }
            }
        }
        return leaves;
    }

    /**
     * Total gas mass of the leaf cells in code units.
     */
    public static double gasMass(int lmax) {
        double total = 0;
        for (int[] cell : leafCells(lmax)) {
            double dx = BOXLEN / (1 << cell[0]);
            total += hydroValue(0, cell[0], cell[1], cell[2], cell[3]) * dx * dx * dx;
        }
        return total;
    }

    private static int[] cellIndex(Grid grid, int ind) {
        double dx = Math.pow(0.5, grid.level());
        int[] offset = { ind % 2, (ind / 2) % 2, ind / 4 };
        int[] index = new int[3];
        for (int dim = 0; dim < 3; dim++) {
            double position = grid.center()[dim] + (offset[dim] - 0.5) * dx;
            index[dim] = (int) Math.floor(position * (1 << grid.level())) + 1;
        }
        return index;
    }

    // ==================== Shard files ====================

    /**
     * Grids of {@code domain} on {@code level} as stored in the file of shard {@code icpu}.
     */
    private static List<Grid> grids(int icpu, int level, int domain) {
        List<Grid> grids = new ArrayList<>();
        for (Grid grid : GRIDS) {
            boolean stored = icpu == 1 || grid != LOWER;
            if (stored && grid.level() == level && grid.domain() == domain) {
                grids.add(grid);
            }
        }
        return grids;
    }

    private static FortranRecordWriter amrFile(int icpu) {
        FortranRecordWriter amr = new FortranRecordWriter()
                .ints(NCPU)
                .ints(3)
                .ints(1, 1, 1)
                .ints(LEVELMAX)
                .ints(NGRIDMAX)
                .ints(0)
                .ints(GRIDS.size())
                .doubles(BOXLEN)
                .ints(1, 1, 1)
                .doubles(TIME)
                .doubles(1.0)
                .doubles(TIME)
                .doubles(0.0)
                .doubles(0.0)
                .ints(10, 10)
                .doubles(0.0, 0.0, 0.0)
                .doubles(0.3, 0.7, 0.0, 0.045, 70.0, 1.0, 0.0)
                .doubles(1.0, 0.0, 0.0, 0.0, 0.0)
                .doubles(0.0)
                .ints(new int[NCPU * LEVELMAX])
                .ints(new int[NCPU * LEVELMAX]);

        int[] numbl = new int[NCPU * LEVELMAX];
        for (int level = 1; level <= LEVELMAX; level++) {
            for (int domain = 1; domain <= NCPU; domain++) {
                numbl[(domain - 1) + NCPU * (level - 1)] = grids(icpu, level, domain).size();
            }
        }
        amr.ints(numbl)
                .ints(new int[10 * LEVELMAX])
                .ints(0, 0)
                .bytes("hilbert".getBytes(StandardCharsets.US_ASCII))
                .doubles(0.0, 4.0, 8.0)
                .ints(1)
                .ints(0)
                .ints(1);

        for (int level = 1; level <= LEVELMAX; level++) {
            for (int domain = 1; domain <= NCPU; domain++) {
                List<Grid> grids = grids(icpu, level, domain);
                int n = grids.size();
                if (n == 0) {
                    continue;
                }
                int[] index = new int[n];
                for (int i = 0; i < n; i++) {
                    index[i] = grids.get(i).index();
                }
                amr.ints(index).ints(new int[n]).ints(new int[n]);
                for (int dim = 0; dim < 3; dim++) {
                    double[] xg = new double[n];
                    for (int i = 0; i < n; i++) {
                        xg[i] = grids.get(i).center()[dim];
                    }
                    amr.doubles(xg);
                }
                for (int record = 0; record < 7; record++) {
                    amr.ints(new int[n]);
                }
                for (int ind = 0; ind < 8; ind++) {
                    int[] son = new int[n];
                    for (int i = 0; i < n; i++) {
                        son[i] = grids.get(i).son()[ind];
                    }
                    amr.ints(son);
                }
                for (int ind = 0; ind < 8; ind++) {
                    int[] cpuMap = new int[n];
                    Arrays.fill(cpuMap, domain);
                    amr.ints(cpuMap);
                }
                for (int ind = 0; ind < 8; ind++) {
                    amr.ints(new int[n]);
                }
            }
        }
        return amr;
    }

    private static FortranRecordWriter cellFile(int icpu, boolean hydro) {
        int nvar = hydro ? HYDRO_VARIABLES : 4;
        FortranRecordWriter data = new FortranRecordWriter().ints(NCPU).ints(nvar);
        if (hydro) {
            data.ints(3).ints(LEVELMAX).ints(0).doubles(GAMMA);
        }
        else {
            data.ints(LEVELMAX).ints(0);
        }
        for (int level = 1; level <= LEVELMAX; level++) {
            for (int domain = 1; domain <= NCPU; domain++) {
                List<Grid> grids = grids(icpu, level, domain);
                int n = grids.size();
                data.ints(level).ints(n);
                for (int ind = 0; ind < 8 && n > 0; ind++) {
                    for (int ivar = 0; ivar < nvar; ivar++) {
                        double[] values = new double[n];
                        for (int i = 0; i < n; i++) {
                            int[] c = cellIndex(grids.get(i), ind);
                            values[i] = hydro
                                    ? hydroValue(ivar, level, c[0], c[1], c[2])
                                    : gravityValue(ivar, level, c[0], c[1], c[2]);
                        }
                        data.doubles(values);
                    }
                }
            }
        }
        return data;
    }

    private FortranRecordWriter particleFile(int icpu) {
        List<Particle> own = PARTICLES.stream().filter(p -> p.cpu() == icpu).toList();
        int n = own.size();
        long nstar = PARTICLES.stream().filter(p -> p.birth() != 0).count();
        FortranRecordWriter part = new FortranRecordWriter()
                .ints(NCPU)
                .ints(3)
                .ints(n)
                .ints(1, 2, 3, 4)
                .ints((int) nstar)
                .doubles(0.0)
                .doubles(0.0)
                .ints(0);
        part.doubles(own.stream().mapToDouble(Particle::x).toArray())
                .doubles(own.stream().mapToDouble(Particle::y).toArray())
                .doubles(own.stream().mapToDouble(Particle::z).toArray())
                .doubles(own.stream().mapToDouble(Particle::vx).toArray())
                .doubles(own.stream().mapToDouble(Particle::vy).toArray())
                .doubles(own.stream().mapToDouble(Particle::vz).toArray())
                .doubles(own.stream().mapToDouble(Particle::mass).toArray());
        if (longIds) {
            part.longs(own.stream().mapToLong(p -> LONG_ID_OFFSET + p.id()).toArray());
        }
        else {
            part.ints(own.stream().mapToInt(Particle::id).toArray());
        }
        part.ints(own.stream().mapToInt(p -> LEVELMAX).toArray());
        if (particleVersion > 0) {
            byte[] family = new byte[n];
            for (int i = 0; i < n; i++) {
                family[i] = own.get(i).family();
            }
            part.bytes(family).bytes(new byte[n]);
        }
        return part.doubles(own.stream().mapToDouble(Particle::birth).toArray());
    }

    // ==================== Text files ====================

    private static List<String> infoLines() {
        List<String> lines = new ArrayList<>();
        lines.add("ncpu        =          " + NCPU);
        lines.add("ndim        =          3");
        lines.add("levelmin    =          " + LEVELMIN);
        lines.add("levelmax    =          " + LEVELMAX);
        lines.add("ngridmax    =        " + NGRIDMAX);
        lines.add("nstep_coarse=         10");
        lines.add("");
        lines.add("boxlen      =" + real(BOXLEN));
        lines.add("time        =" + real(TIME));
        lines.add("aexp        =" + real(1.0));
        lines.add("H0          =" + real(70.0));
        lines.add("omega_m     =" + real(0.3));
        lines.add("omega_l     =" + real(0.7));
        lines.add("omega_k     =" + real(0.0));
        lines.add("omega_b     =" + real(0.045));
        lines.add("unit_l      =" + real(UNIT_L));
        lines.add("unit_d      =" + real(UNIT_D));
        lines.add("unit_t      =" + real(UNIT_T));
        lines.add("");
        lines.add("ordering type=hilbert");
        lines.add("   DOMAIN   ind_min                 ind_max");
        lines.add("       1" + real(0.0) + real(4.0));
        lines.add("       2" + real(4.0) + real(8.0));
        return lines;
    }

    private List<String> headerLines() {
        if (particleVersion == 0) {
            long stars = PARTICLES.stream().filter(p -> p.birth() != 0).count();
            return List.of(
                    "Total number of particles",
                    "          " + PARTICLES.size(),
                    "Total number of dark matter particles",
                    "          " + (PARTICLES.size() - stars),
                    "Total number of star particles",
                    "          " + stars,
                    "Total number of sink particles",
                    "          0",
                    "Particle fields",
                    "pos vel mass iord level birth_time");
        }
        String[] names = { "other_tracer1", "debris_tracer", "cloud_tracer", "star_tracer", "other_tracer2",
                "gas_tracer", "DM", "star", "cloud", "debris", "other", "undefined" };
        int[] familyCodes = { -5, -4, -3, -2, -5, 0, 1, 2, 3, 4, 5, 127 };
        List<String> lines = new ArrayList<>();
        lines.add("# Family     Count");
        for (int i = 0; i < names.length; i++) {
            int code = familyCodes[i];
            long count = PARTICLES.stream().filter(p -> p.family() == code).count();
            lines.add(String.format(Locale.ROOT, "%-14s %10d", names[i], count));
        }
        lines.add("Particle fields");
        lines.add("pos vel mass iord level family tag birth_time");
        return lines;
    }

    private static List<String> clumpLines(int icpu) {
        List<String> lines = new ArrayList<>();
        lines.add(" " + String.join("  ", CLUMP_COLUMNS));
        if (icpu == 1) {
            lines.add("  1  1  1  10  30.0  30.0  30.0  0.1  5.0  1.0  0.5  3.0");
        }
        else {
            lines.add("  2  1  2   8  70.0  60.0  40.0  0.1  4.0  0.8  0.25  2.0");
        }
        return lines;
    }

    private static String real(double value) {
        return String.format(Locale.ROOT, "%24.15E", value);
    }

    private static String pad(int number) {
        return String.format("%05d", number);
    }

    private static void writeLines(Path path, List<String> lines) throws IOException {
        Files.write(path, lines, StandardCharsets.US_ASCII);
    }
}
