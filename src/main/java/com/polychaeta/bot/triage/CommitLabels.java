package com.polychaeta.bot.triage;

import java.util.Map;
import java.util.Optional;

/**
 * Commit subject prefixes (daemon directories and build files) and the topic label each maps to.
 */
public final class CommitLabels {
    private CommitLabels() {
    }

    private static final Map<String, String> LABELS = Map.ofEntries(
            Map.entry("babeld", "babel"),
            Map.entry("bfdd", "bfd"),
            Map.entry("bgpd", "bgp"),
            Map.entry("debian", "packaging"),
            Map.entry("doc", "documentation"),
            Map.entry("docker", "docker"),
            Map.entry("eigrpd", "eigrp"),
            Map.entry("fpm", "fpm"),
            Map.entry("isisd", "isis"),
            Map.entry("ldpd", "ldp"),
            Map.entry("lib", "libfrr"),
            Map.entry("nhrpd", "nhrp"),
            Map.entry("ospf6d", "ospfv3"),
            Map.entry("ospfd", "ospf"),
            Map.entry("pbrd", "pbr"),
            Map.entry("pimd", "pim"),
            Map.entry("pkgsrc", "packaging"),
            Map.entry("python", "clippy"),
            Map.entry("redhat", "packaging"),
            Map.entry("ripd", "rip"),
            Map.entry("ripngd", "ripng"),
            Map.entry("sharpd", "sharp"),
            Map.entry("snapcraft", "packaging"),
            Map.entry("solaris", "packaging"),
            Map.entry("staticd", "staticd"),
            Map.entry("tests", "tests"),
            Map.entry("tools", "tools"),
            Map.entry("vtysh", "vtysh"),
            Map.entry("vrrp", "vrrp"),
            Map.entry("watchfrr", "watchfrr"),
            Map.entry("yang", "yang"),
            Map.entry("zebra", "zebra"),
            // files
            Map.entry("configure.ac", "build"),
            Map.entry("Makefile.am", "build"),
            Map.entry("bootstrap.sh", "build")
    );

    public static Optional<String> labelFor(String prefix) {
        return Optional.ofNullable(LABELS.get(prefix));
    }
}
