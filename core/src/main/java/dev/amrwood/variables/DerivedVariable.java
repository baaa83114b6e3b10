/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.amrwood.variables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.IntToDoubleFunction;

import dev.amrwood.metadata.Component;
import dev.amrwood.units.BaseUnits;
import dev.amrwood.units.PhysicalConstants;

import static dev.amrwood.metadata.Component.CLUMPS;
import static dev.amrwood.metadata.Component.GRAVITY;
import static dev.amrwood.metadata.Component.HYDRO;
import static dev.amrwood.metadata.Component.PARTICLES;

/**
 * Registry of the quantities getvar derives from stored columns.
 * <p>
 * Each entry names the components it applies to, the keys it is computed from
 * (stored columns, other derived keys, or the position, velocity and acceleration
 * triplets), the power its unit factor is raised to, and a pure function that
 * computes it in code units. A key may have one entry per component family, for
 * example {@code mass} of cells and of clumps.
 * </p>
 */
public enum DerivedVariable {

    // ==================== Geometry ====================

    CELLSIZE("cellsize", EnumSet.of(HYDRO, GRAVITY), 1, List.of("level"), c -> {
        double[] level = c.column("level");
        return each(c, i -> c.boxlen() / Math.pow(2, level[i]));
    }),
    VOLUME("volume", EnumSet.of(HYDRO, GRAVITY), 1, List.of("cellsize"), c -> {
        double[] size = c.get("cellsize");
        return each(c, i -> size[i] * size[i] * size[i]);
    }),
    X("x", spatial(), 1, List.of(DerivedVariable.POSITION), c -> c.position(0)),
    Y("y", spatial(), 1, List.of(DerivedVariable.POSITION), c -> c.position(1)),
    Z("z", spatial(), 1, List.of(DerivedVariable.POSITION), c -> c.position(2)),
    R_CYLINDER("r_cylinder", spatial(), 1, List.of(DerivedVariable.POSITION), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        return each(c, i -> Math.sqrt(x[i] * x[i] + y[i] * y[i]));
    }),
    R_SPHERE("r_sphere", spatial(), 1, List.of(DerivedVariable.POSITION), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] z = c.position(2);
        return each(c, i -> Math.sqrt(x[i] * x[i] + y[i] * y[i] + z[i] * z[i]));
    }),
    PHI("ϕ", spatial(), 1, List.of(DerivedVariable.POSITION), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        return each(c, i -> Math.atan2(y[i], x[i]));
    }, "phi"),
    CX("cx", EnumSet.of(HYDRO, GRAVITY), 1, List.of(DerivedVariable.POSITION), c -> c.centeredIndex(0)),
    CY("cy", EnumSet.of(HYDRO, GRAVITY), 1, List.of(DerivedVariable.POSITION), c -> c.centeredIndex(1)),
    CZ("cz", EnumSet.of(HYDRO, GRAVITY), 1, List.of(DerivedVariable.POSITION), c -> c.centeredIndex(2)),

    // ==================== Mass and kinematics ====================

    MASS("mass", EnumSet.of(HYDRO), 1, List.of("rho", "cellsize"), c -> {
        double[] rho = c.column("rho");
        double[] size = c.get("cellsize");
        return each(c, i -> rho[i] * size[i] * size[i] * size[i]);
    }),
    CLUMP_MASS("mass", EnumSet.of(CLUMPS), 1, List.of("mass_cl"), c -> c.column("mass_cl")),
    V("v", EnumSet.of(HYDRO, PARTICLES, CLUMPS), 1, List.of(DerivedVariable.VELOCITY), c -> {
        double[] vx = c.velocity(0);
        double[] vy = c.velocity(1);
        double[] vz = c.velocity(2);
        return each(c, i -> Math.sqrt(vx[i] * vx[i] + vy[i] * vy[i] + vz[i] * vz[i]));
    }),
    V2("v2", EnumSet.of(HYDRO, PARTICLES), 2, List.of("v"), c -> square(c, c.get("v"))),
    VX2("vx2", EnumSet.of(HYDRO, PARTICLES), 2, List.of(DerivedVariable.VELOCITY), c -> square(c, c.velocity(0))),
    VY2("vy2", EnumSet.of(HYDRO, PARTICLES), 2, List.of(DerivedVariable.VELOCITY), c -> square(c, c.velocity(1))),
    VZ2("vz2", EnumSet.of(HYDRO, PARTICLES), 2, List.of(DerivedVariable.VELOCITY), c -> square(c, c.velocity(2))),
    EKIN("ekin", EnumSet.of(HYDRO, PARTICLES, CLUMPS), 1, List.of("mass", "v"), c -> {
        double[] mass = c.get("mass");
        double[] v = c.get("v");
        return each(c, i -> 0.5 * mass[i] * v[i] * v[i]);
    }),
    VR_CYLINDER("vr_cylinder", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] vx = c.velocity(0);
        double[] vy = c.velocity(1);
        return each(c, i -> ratio(x[i] * vx[i] + y[i] * vy[i], Math.hypot(x[i], y[i])));
    }),
    VPHI_CYLINDER("vϕ_cylinder", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] vx = c.velocity(0);
        double[] vy = c.velocity(1);
        return each(c, i -> ratio(x[i] * vy[i] - y[i] * vx[i], Math.hypot(x[i], y[i])));
    }, "vphi_cylinder"),
    VR_CYLINDER2("vr_cylinder2", EnumSet.of(HYDRO), 2, List.of("vr_cylinder"), c -> square(c, c.get("vr_cylinder"))),
    VPHI_CYLINDER2("vϕ_cylinder2", EnumSet.of(HYDRO), 2, List.of("vϕ_cylinder"),
            c -> square(c, c.get("vϕ_cylinder")), "vphi_cylinder2"),
    VR_SPHERE("vr_sphere", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] z = c.position(2);
        double[] vx = c.velocity(0);
        double[] vy = c.velocity(1);
        double[] vz = c.velocity(2);
        return each(c, i -> ratio(x[i] * vx[i] + y[i] * vy[i] + z[i] * vz[i],
                Math.sqrt(x[i] * x[i] + y[i] * y[i] + z[i] * z[i])));
    }),
    VTHETA_SPHERE("vθ_sphere", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] z = c.position(2);
        double[] vx = c.velocity(0);
        double[] vy = c.velocity(1);
        double[] vz = c.velocity(2);
        return each(c, i -> {
            double cylinder2 = x[i] * x[i] + y[i] * y[i];
            double sphere = Math.sqrt(cylinder2 + z[i] * z[i]);
            return ratio(z[i] * (x[i] * vx[i] + y[i] * vy[i]) - cylinder2 * vz[i], sphere * Math.sqrt(cylinder2));
        });
    }, "vtheta_sphere"),
    VPHI_SPHERE("vϕ_sphere", EnumSet.of(HYDRO, PARTICLES), 1, List.of("vϕ_cylinder"),
            c -> c.get("vϕ_cylinder"), "vphi_sphere"),
    HX("hx", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] y = c.position(1);
        double[] z = c.position(2);
        double[] vy = c.velocity(1);
        double[] vz = c.velocity(2);
        return each(c, i -> y[i] * vz[i] - z[i] * vy[i]);
    }),
    HY("hy", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] x = c.position(0);
        double[] z = c.position(2);
        double[] vx = c.velocity(0);
        double[] vz = c.velocity(2);
        return each(c, i -> z[i] * vx[i] - x[i] * vz[i]);
    }),
    HZ("hz", EnumSet.of(HYDRO, PARTICLES), 1, kinematic(), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] vx = c.velocity(0);
        double[] vy = c.velocity(1);
        return each(c, i -> x[i] * vy[i] - y[i] * vx[i]);
    }),
    H("h", EnumSet.of(HYDRO, PARTICLES), 1, List.of("hx", "hy", "hz"), c -> {
        double[] hx = c.get("hx");
        double[] hy = c.get("hy");
        double[] hz = c.get("hz");
        return each(c, i -> Math.sqrt(hx[i] * hx[i] + hy[i] * hy[i] + hz[i] * hz[i]));
    }),
    LX("lx", EnumSet.of(HYDRO, PARTICLES), 1, List.of("mass", "hx"), c -> product(c, c.get("mass"), c.get("hx"))),
    LY("ly", EnumSet.of(HYDRO, PARTICLES), 1, List.of("mass", "hy"), c -> product(c, c.get("mass"), c.get("hy"))),
    LZ("lz", EnumSet.of(HYDRO, PARTICLES), 1, List.of("mass", "hz"), c -> product(c, c.get("mass"), c.get("hz"))),
    L("l", EnumSet.of(HYDRO, PARTICLES), 1, List.of("mass", "h"), c -> product(c, c.get("mass"), c.get("h"))),
    AGE("age", EnumSet.of(PARTICLES), 1, List.of("birth"), c -> {
        double[] birth = c.column("birth");
        return each(c, i -> c.referenceTime() - birth[i]);
    }),

    // ==================== Thermodynamics ====================

    ETHERM("etherm", EnumSet.of(HYDRO), 1, List.of("p", "volume"), c -> product(c, c.column("p"), c.get("volume"))),
    CS("cs", EnumSet.of(HYDRO), 1, List.of("p", "rho"), c -> {
        double[] p = c.column("p");
        double[] rho = c.column("rho");
        return each(c, i -> Math.sqrt(c.gamma() * p[i] / rho[i]));
    }),
    MACH("mach", EnumSet.of(HYDRO), 1, List.of("v", "cs"), c -> quotient(c, c.get("v"), c.get("cs"))),
    MACHX("machx", EnumSet.of(HYDRO), 1, List.of(DerivedVariable.VELOCITY, "cs"),
            c -> quotient(c, c.velocity(0), c.get("cs"))),
    MACHY("machy", EnumSet.of(HYDRO), 1, List.of(DerivedVariable.VELOCITY, "cs"),
            c -> quotient(c, c.velocity(1), c.get("cs"))),
    MACHZ("machz", EnumSet.of(HYDRO), 1, List.of(DerivedVariable.VELOCITY, "cs"),
            c -> quotient(c, c.velocity(2), c.get("cs"))),
    MACH_R_CYLINDER("mach_r_cylinder", EnumSet.of(HYDRO), 1, List.of("vr_cylinder", "cs"),
            c -> quotient(c, c.get("vr_cylinder"), c.get("cs"))),
    MACH_PHI_CYLINDER("mach_phi_cylinder", EnumSet.of(HYDRO), 1, List.of("vϕ_cylinder", "cs"),
            c -> quotient(c, c.get("vϕ_cylinder"), c.get("cs"))),
    MACH_R_SPHERE("mach_r_sphere", EnumSet.of(HYDRO), 1, List.of("vr_sphere", "cs"),
            c -> quotient(c, c.get("vr_sphere"), c.get("cs"))),
    TEMPERATURE("T", EnumSet.of(HYDRO), 1, List.of("p", "rho"),
            c -> quotient(c, c.column("p"), c.column("rho")), "Temp", "Temperature"),
    JEANSLENGTH("jeanslength", EnumSet.of(HYDRO), 1, List.of("cs", "rho"), c -> {
        double[] cs = c.get("cs");
        double[] rho = c.column("rho");
        double g = c.gravitationalConstant();
        return each(c, i -> cs[i] * Math.sqrt(3 * Math.PI / (32 * g * rho[i])));
    }),
    JEANSNUMBER("jeansnumber", EnumSet.of(HYDRO), 1, List.of("jeanslength", "cellsize"),
            c -> quotient(c, c.get("jeanslength"), c.get("cellsize"))),
    JEANSMASS("jeansmass", EnumSet.of(HYDRO), 1, List.of("jeanslength", "rho"), c -> {
        double[] length = c.get("jeanslength");
        double[] rho = c.column("rho");
        return each(c, i -> 4.0 / 3.0 * Math.PI * Math.pow(length[i] / 2, 3) * rho[i]);
    }),
    FREEFALL_TIME("freefall_time", EnumSet.of(HYDRO), 1, List.of("rho"), c -> {
        double[] rho = c.column("rho");
        double g = c.gravitationalConstant();
        return each(c, i -> Math.sqrt(3 * Math.PI / (32 * g * rho[i])));
    }),
    VIRIAL_PARAMETER_LOCAL("virial_parameter_local", EnumSet.of(HYDRO), 1, List.of("cs", "cellsize", "mass"), c -> {
        double[] cs = c.get("cs");
        double[] size = c.get("cellsize");
        double[] mass = c.get("mass");
        double g = c.gravitationalConstant();
        return each(c, i -> 5 * cs[i] * cs[i] * size[i] / (g * mass[i]));
    }),
    ENTROPY_INDEX("entropy_index", EnumSet.of(HYDRO), 1, List.of("p", "rho"), c -> {
        double[] p = c.column("p");
        double[] rho = c.column("rho");
        return each(c, i -> p[i] / Math.pow(rho[i], c.gamma()));
    }),
    ENTROPY_SPECIFIC("entropy_specific", EnumSet.of(HYDRO), 1, List.of("entropy_index"), c -> {
        double[] index = c.get("entropy_index");
        BaseUnits units = c.baseUnits();
        // code unit of specific entropy is unitV^2 / kB
        double toCode = PhysicalConstants.KB / (units.unitV() * units.unitV());
        double prefactor = PhysicalConstants.KB / PhysicalConstants.AMU / (c.gamma() - 1) * toCode;
        return each(c, i -> prefactor * Math.log(index[i]));
    }),
    ENTROPY_DENSITY("entropy_density", EnumSet.of(HYDRO), 1, List.of("rho", "entropy_specific"),
            c -> product(c, c.column("rho"), c.get("entropy_specific"))),
    ENTROPY_PER_PARTICLE("entropy_per_particle", EnumSet.of(HYDRO), 1, List.of("entropy_specific"), c -> {
        double[] s = c.get("entropy_specific");
        double amu = PhysicalConstants.AMU / c.baseUnits().unitM();
        return each(c, i -> s[i] * amu);
    }),
    ENTROPY_TOTAL("entropy_total", EnumSet.of(HYDRO), 1, List.of("entropy_specific", "mass"),
            c -> product(c, c.get("entropy_specific"), c.get("mass"))),

    // ==================== Gravity ====================

    A_MAGNITUDE("a_magnitude", EnumSet.of(GRAVITY), 1, List.of(DerivedVariable.ACCELERATION), c -> {
        double[] ax = c.acceleration(0);
        double[] ay = c.acceleration(1);
        double[] az = c.acceleration(2);
        return each(c, i -> Math.sqrt(ax[i] * ax[i] + ay[i] * ay[i] + az[i] * az[i]));
    }),
    ESCAPE_SPEED("escape_speed", EnumSet.of(GRAVITY), 1, List.of("epot"), c -> {
        double[] epot = c.column("epot");
        return each(c, i -> Math.sqrt(Math.max(0.0, -2 * epot[i])));
    }),
    SPECIFIC_GRAVITATIONAL_ENERGY("specific_gravitational_energy", EnumSet.of(GRAVITY), 1, List.of("epot"),
            c -> c.column("epot")),
    GRAVITATIONAL_REDSHIFT("gravitational_redshift", EnumSet.of(GRAVITY), 1, List.of("epot"), c -> {
        double[] epot = c.column("epot");
        double unitV = c.baseUnits().unitV();
        double c2 = PhysicalConstants.C * PhysicalConstants.C;
        return each(c, i -> epot[i] * unitV * unitV / c2);
    }),
    AR_CYLINDER("ar_cylinder", EnumSet.of(GRAVITY), 1, List.of(DerivedVariable.POSITION, DerivedVariable.ACCELERATION), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] ax = c.acceleration(0);
        double[] ay = c.acceleration(1);
        return each(c, i -> ratio(x[i] * ax[i] + y[i] * ay[i], Math.hypot(x[i], y[i])));
    }),
    APHI_CYLINDER("aϕ_cylinder", EnumSet.of(GRAVITY), 1, List.of(DerivedVariable.POSITION, DerivedVariable.ACCELERATION), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] ax = c.acceleration(0);
        double[] ay = c.acceleration(1);
        return each(c, i -> ratio(x[i] * ay[i] - y[i] * ax[i], Math.hypot(x[i], y[i])));
    }, "aphi_cylinder"),
    AR_SPHERE("ar_sphere", EnumSet.of(GRAVITY), 1, List.of(DerivedVariable.POSITION, DerivedVariable.ACCELERATION), c -> {
        double[] x = c.position(0);
        double[] y = c.position(1);
        double[] z = c.position(2);
        double[] ax = c.acceleration(0);
        double[] ay = c.acceleration(1);
        double[] az = c.acceleration(2);
        return each(c, i -> ratio(x[i] * ax[i] + y[i] * ay[i] + z[i] * az[i],
                Math.sqrt(x[i] * x[i] + y[i] * y[i] + z[i] * z[i])));
    });

    /** Needs the three position columns of the component. */
    static final String POSITION = "@position";
    /** Needs vx, vy and vz. */
    static final String VELOCITY = "@velocity";
    /** Needs ax, ay and az. */
    static final String ACCELERATION = "@acceleration";

    private static final Map<String, List<DerivedVariable>> BY_KEY = new HashMap<>();

    static {
        for (DerivedVariable variable : values()) {
            for (String name : variable.names()) {
                BY_KEY.computeIfAbsent(name, k -> new ArrayList<>()).add(variable);
            }
        }
    }

    private final String key;
    private final Set<Component> components;
    private final int unitPower;
    private final List<String> needs;
    private final Function<VariableContext, double[]> compute;
    private final List<String> aliases;

    DerivedVariable(String key, Set<Component> components, int unitPower, List<String> needs,
                    Function<VariableContext, double[]> compute, String... aliases) {
        this.key = key;
        this.components = Collections.unmodifiableSet(components);
        this.unitPower = unitPower;
        this.needs = needs;
        this.compute = compute;
        this.aliases = List.of(aliases);
    }

    /**
     * Finds the entry for a key or alias that applies to the component.
     */
    public static Optional<DerivedVariable> find(String name, Component component) {
        List<DerivedVariable> candidates = BY_KEY.getOrDefault(name, List.of());
        for (DerivedVariable candidate : candidates) {
            if (candidate.components.contains(component)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Sorted keys derivable for a component, aliases excluded.
     */
    public static Set<String> keys(Component component) {
        Set<String> keys = new TreeSet<>();
        for (DerivedVariable variable : values()) {
            if (variable.components.contains(component)) {
                keys.add(variable.key);
            }
        }
        return keys;
    }

    public String key() {
        return key;
    }

    public List<String> aliases() {
        return aliases;
    }

    public Set<Component> components() {
        return components;
    }

    /**
     * Power the unit factor is raised to; 2 for squared quantities.
     */
    public int unitPower() {
        return unitPower;
    }

    /**
     * Stored columns this quantity is computed from on the given component, following
     * derived dependencies.
     */
    public Set<String> requiredColumns(Component component) {
        Set<String> columns = new LinkedHashSet<>();
        collect(component, columns);
        return columns;
    }

    private void collect(Component component, Set<String> columns) {
        for (String need : needs) {
            switch (need) {
                case POSITION -> columns.addAll(positionColumns(component));
                case VELOCITY -> columns.addAll(List.of("vx", "vy", "vz"));
                case ACCELERATION -> columns.addAll(List.of("ax", "ay", "az"));
                default -> {
                    Optional<DerivedVariable> derived = find(need, component);
                    if (derived.isPresent()) {
                        derived.get().collect(component, columns);
                    }
                    else {
                        columns.add(need);
                    }
                }
            }
        }
    }

    private static List<String> positionColumns(Component component) {
        if (component.isCellBased()) {
            return List.of("cx", "cy", "cz", "level");
        }
        if (component == CLUMPS) {
            return List.of("peak_x", "peak_y", "peak_z");
        }
        return List.of("x", "y", "z");
    }

    double[] compute(VariableContext context) {
        return compute.apply(context);
    }

    private List<String> names() {
        List<String> names = new ArrayList<>(aliases.size() + 1);
        names.add(key);
        names.addAll(aliases);
        return names;
    }

    private static Set<Component> spatial() {
        return EnumSet.of(HYDRO, GRAVITY, PARTICLES, CLUMPS);
    }

    private static List<String> kinematic() {
        return List.of(POSITION, VELOCITY);
    }

    private static double[] each(VariableContext context, IntToDoubleFunction function) {
        double[] result = new double[context.rows()];
        for (int i = 0; i < result.length; i++) {
            result[i] = function.applyAsDouble(i);
        }
        return result;
    }

    private static double[] square(VariableContext context, double[] values) {
        return each(context, i -> values[i] * values[i]);
    }

    private static double[] product(VariableContext context, double[] a, double[] b) {
        return each(context, i -> a[i] * b[i]);
    }

    private static double[] quotient(VariableContext context, double[] a, double[] b) {
        return each(context, i -> a[i] / b[i]);
    }

    /** Components along a radius are 0 where the radius is 0. */
    private static double ratio(double numerator, double radius) {
        return radius == 0 ? 0.0 : numerator / radius;
    }
}
