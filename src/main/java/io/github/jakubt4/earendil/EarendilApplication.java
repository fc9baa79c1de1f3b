package io.github.jakubt4.earendil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Earendil — astrometric plate solver.
 *
 * <p>Matches star quads detected in an image against a pre-built, sky-partitioned quad
 * catalog, fits plate constants to the matches and derives the image's World Coordinate
 * System (center, orientation, pixel scale, parity). Search units are scanned in parallel
 * on a bounded worker pool; the first run that produces a valid solution wins.
 *
 * @see io.github.jakubt4.earendil.solver.PlateSolver
 * @see io.github.jakubt4.earendil.catalog.QuadDatabaseBuilder
 */
@SpringBootApplication
public class EarendilApplication {

    public static void main(String[] args) {
        SpringApplication.run(EarendilApplication.class, args);
    }
}
