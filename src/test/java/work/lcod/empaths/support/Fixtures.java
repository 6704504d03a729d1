package work.lcod.empaths.support;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Object graphs shared by the resolver tests.
 */
public final class Fixtures {
    private Fixtures() {}

    public record Address(String street, String city, int zip) {}

    public record Person(String name, int age, boolean active, Address address, List<String> tags, Map<String, Integer> scores) {
        public String getFullName() {
            return "Mx " + name;
        }

        public boolean isAdult() {
            return age >= 18;
        }
    }

    public record Item(String name, double price) {}

    public record Holder(Optional<Address> inner) {}

    public enum Role { ADMIN, USER }

    /**
     * Plain class mixing public fields, accessors that take arguments and accessors that fail.
     */
    public static final class Account {
        public static String VERSION = "1";

        public String owner = "bob";
        public String greet = "field-greet";
        public String touch = "touched";
        public Role role = Role.ADMIN;
        private String secret = "hidden";
        private String pin = "1234";

        public String greet(String who) {
            return "Hello " + who;
        }

        public void touch() {
        }

        public String explode() {
            throw new IllegalStateException("boom");
        }

        public String checked() throws IOException {
            throw new IOException("disk gone");
        }

        public String secret() {
            return secret;
        }

        String pin() {
            return pin;
        }
    }

    public static Person alice() {
        var scores = new LinkedHashMap<String, Integer>();
        scores.put("math", 95);
        scores.put("science", 88);
        return new Person("Alice", 30, true, new Address("Main St", "NYC", 10001), List.of("developer", "gopher", "tester"), scores);
    }

    public static Person bob() {
        return new Person("Bob", 16, false, new Address("Elm St", "Boston", 2101), List.of(), Map.of());
    }
}
