package com.khaounen.edgeguard.security.exclusion;

import com.khaounen.edgeguard.utils.IpUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@Slf4j
public class IpsetPacketFilterBackend implements PacketFilterBackend {

    private final List<String> command;
    private final String setName;
    private final Duration timeout;

    public IpsetPacketFilterBackend(List<String> command, String setName, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("ipset command must not be empty");
        }
        this.command = List.copyOf(command);
        this.setName = setName;
        this.timeout = timeout;
    }

    @Override
    public void block(String address) {
        run(List.of("add", setName, requireLiteral(address), "-exist"));
    }

    @Override
    public void unblock(String address) {
        run(List.of("del", setName, requireLiteral(address), "-exist"));
    }

    @Override
    public Set<String> listBlocked() {
        return parseMembers(run(List.of("list", setName)));
    }

    static Set<String> parseMembers(String output) {
        Set<String> members = new LinkedHashSet<>();
        boolean inMembers = false;
        for (String line : output.split("\\R")) {
            String trimmed = line.trim();
            if (!inMembers) {
                inMembers = trimmed.equals("Members:");
                continue;
            }
            if (trimmed.isEmpty()) {
                continue;
            }
            String member = IpUtils.normalize(trimmed.split("\\s+")[0]);
            if (IpUtils.isIpLiteral(member)) {
                members.add(member);
            }
        }
        return members;
    }

    private String run(List<String> arguments) {
        List<String> cmd = new ArrayList<>(command);
        cmd.addAll(arguments);
        Path output = null;
        Process process = null;
        try {
            output = Files.createTempFile("edge-guard-ipset", ".out");
            ProcessBuilder pb = new ProcessBuilder(cmd);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            process = pb.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new PacketFilterException(
                        String.join(" ", cmd) + " timed out after " + timeout.toMillis() + "ms", false
                );
            }
            String text = Files.readString(output, StandardCharsets.UTF_8);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new PacketFilterException(
                        String.join(" ", cmd) + " exited with " + exitCode + ": " + text.trim(),
                        isPrivilegeProblem(text)
                );
            }
            log.debug("{} ok", String.join(" ", cmd));
            return text;
        } catch (IOException ex) {
            throw new PacketFilterException("cannot run " + command.get(0) + ": " + ex.getMessage(), true, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PacketFilterException("interrupted while running " + String.join(" ", cmd), false, ex);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(output);
        }
    }

    private static boolean isPrivilegeProblem(String output) {
        String lower = output.toLowerCase(Locale.ROOT);
        return lower.contains("operation not permitted")
                || lower.contains("permission denied")
                || lower.contains("a password is required");
    }

    private static String requireLiteral(String address) {
        if (!IpUtils.isIpLiteral(address)) {
            throw new PacketFilterException("refusing to pass non-IP value to ipset: " + address, false);
        }
        return address;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            log.debug("could not delete {}: {}", path, ex.getMessage());
        }
    }
}
