package org.Aayush.dvrp.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testMainOutputsExpectedLines() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer));
            Main.main(new String[]{"3"});
        } finally {
            System.setOut(originalOut);
        }

        String output = buffer.toString();
        assertTrue(output.contains("CVRP solved successfully. Solution ID: demo"));
        assertTrue(output.contains("Total distance:"));
        assertTrue(output.contains("Tractor_1"));
        assertTrue(output.contains("Solution demo already exists"));
    }
}
