package io.maia.cli;

/**
 * The application main class.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(new MaiaCli(System.getenv(), System.out, System.err).run(args));
    }
}
