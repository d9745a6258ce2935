package io.resumable.http;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HttpBatchMainTest {
    private static int run(String... args) {
        return new CommandLine(new HttpBatchMain()).execute(args);
    }

    @Test
    void posts_every_line_and_exits_zero() throws Exception {
        Path dir = Files.createTempDirectory("http-batch");
        Path input = dir.resolve("users.txt");
        Files.writeString(input, "alice\nbob\n\ncarol\n");
        try (StubServer server = new StubServer(body -> body.equals("bob") ? 400 : 200)) {
            int code = run("--input", input.toString(), "--url", server.uri().toString(),
                    "--state-dir", dir.resolve("state").toString(), "--max-retries", "0");
            assertEquals(0, code);
            assertEquals(List.of("alice", "bob", "carol"), server.bodies);
            List<String> dead = Files.readAllLines(dir.resolve("state").resolve("dead-letters.jsonl"));
            assertEquals(1, dead.size());
            assertTrue(dead.get(0).contains("\"offset\":1"));
        }
    }

    @Test
    void quota_pause_then_second_invocation_continues() throws Exception {
        Path dir = Files.createTempDirectory("http-batch");
        Path input = dir.resolve("orders.txt");
        Files.writeString(input, "1\n2\n3\n");
        String state = dir.resolve("state").toString();
        try (StubServer server = new StubServer(body -> 200)) {
            assertEquals(0, run("--input", input.toString(), "--url", server.uri().toString(),
                    "--state-dir", state, "--quota", "2"));
            assertEquals(List.of("1", "2"), server.bodies);

            // more quota next time; consumption so far is restored from the state dir
            assertEquals(0, run("--input", input.toString(), "--url", server.uri().toString(),
                    "--state-dir", state, "--quota", "3"));
            assertEquals(List.of("1", "2", "3"), server.bodies);
        }
    }

    @Test
    void abort_policy_exits_with_failure_code() throws Exception {
        Path dir = Files.createTempDirectory("http-batch");
        Path input = dir.resolve("rows.txt");
        Files.writeString(input, "good\nbad\nnever\n");
        try (StubServer server = new StubServer(body -> body.equals("bad") ? 404 : 200)) {
            int code = run("--input", input.toString(), "--url", server.uri().toString(),
                    "--state-dir", dir.resolve("state").toString(), "--on-failure", "ABORT_JOB");
            assertEquals(HttpBatchMain.EXIT_FAILED, code);
            assertEquals(List.of("good", "bad"), server.bodies);
        }
    }

    @Test
    void finished_job_is_not_posted_again_unless_restarted() throws Exception {
        Path dir = Files.createTempDirectory("http-batch");
        Path input = dir.resolve("invoices.txt");
        Files.writeString(input, "a\nb\n");
        String state = dir.resolve("state").toString();
        try (StubServer server = new StubServer(body -> 200)) {
            String[] args = {"--input", input.toString(), "--url", server.uri().toString(), "--state-dir", state};
            assertEquals(0, run(args));
            assertEquals(0, run(args));
            assertEquals(List.of("a", "b"), server.bodies);

            assertEquals(0, run("--input", input.toString(), "--url", server.uri().toString(), "--state-dir", state, "--restart"));
            assertEquals(List.of("a", "b", "a", "b"), server.bodies);
        }
    }

    @Test
    void missing_required_option_is_a_usage_error() {
        assertEquals(CommandLine.ExitCode.USAGE, run("--url", "http://127.0.0.1:1/x"));
    }
}
