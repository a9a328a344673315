package org.csu.texmath.compiler.renderer;

import java.util.HashSet;
import java.util.Set;

/**
 * 24 个希腊字母名，小写和首字母大写两种写法，例如 alpha / Alpha。
 */
final class GreekLetters {

    private static final String[] NAMES = {
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta",
            "eta", "theta", "iota", "kappa", "lambda", "mu",
            "nu", "xi", "omicron", "pi", "rho", "sigma",
            "tau", "upsilon", "phi", "chi", "psi", "omega"
    };

    private static final Set<String> ALL;

    static {
        ALL = new HashSet<>();
        for (String name : NAMES) {
            ALL.add(name);
            ALL.add(Character.toUpperCase(name.charAt(0)) + name.substring(1));
        }
    }

    private GreekLetters() {
    }

    static boolean contains(String name) {
        return ALL.contains(name);
    }
}
