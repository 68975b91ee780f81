package com.tazifor.planner.geo.util;

import com.tazifor.planner.exception.InvalidCoordinateException;
import com.tazifor.planner.exception.InvalidParameterException;
import com.tazifor.planner.geo.model.LatLon;
import com.tazifor.planner.geo.model.Polygon;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Geo math and point-in-polygon")
class GeoTest {

    private static final Polygon UNIT_SQUARE = Polygon.of(
        LatLon.of(0, 0), LatLon.of(0, 1), LatLon.of(1, 1), LatLon.of(1, 0));

    @Nested
    @DisplayName("Haversine distance")
    class Distance {

        @Test
        @DisplayName("One degree of latitude is ~111.19 km on the mean-radius sphere")
        void oneDegreeLatitude() {
            assertEquals(111.19492664455873, Geo.distanceKm(LatLon.of(0, 0), LatLon.of(1, 0)), 1e-9);
        }

        @Test
        @DisplayName("Equatorial 0.01 and 0.02 degree legs match the itinerary example")
        void equatorialLegs() {
            assertEquals(1.1119492664455874, Geo.distanceKm(LatLon.of(0, 0), LatLon.of(0, 0.01)), 1e-9);
            assertEquals(2.223898532891175, Geo.distanceKm(LatLon.of(0, 0), LatLon.of(0, 0.02)), 1e-9);
        }

        @Test
        @DisplayName("Meters and kilometers agree; distance is symmetric and zero to itself")
        void unitsAndSymmetry() {
            LatLon rome = LatLon.of(41.9028, 12.4964);
            LatLon milan = LatLon.of(45.4642, 9.19);
            assertEquals(Geo.distanceKm(rome, milan) * 1000, Geo.distanceMeters(rome, milan), 1e-6);
            assertEquals(Geo.distanceKm(rome, milan), Geo.distanceKm(milan, rome), 1e-12);
            assertEquals(0.0, Geo.distanceKm(rome, rome), 0.0);
        }

        @Test
        @DisplayName("Antipodal points give half the circumference without NaN")
        void antipodal() {
            double km = Geo.distanceKm(LatLon.of(0, 0), LatLon.of(0, 180));
            assertEquals(Math.PI * Geo.EARTH_RADIUS_KM, km, 1e-6);
        }

        @Test
        @DisplayName("Non-finite or out-of-range coordinates are rejected")
        void invalidCoordinates() {
            LatLon ok = LatLon.of(0, 0);
            assertThrows(InvalidCoordinateException.class, () -> Geo.distanceKm(ok, LatLon.of(Double.NaN, 0)));
            assertThrows(InvalidCoordinateException.class, () -> Geo.distanceKm(ok, LatLon.of(0, Double.POSITIVE_INFINITY)));
            assertThrows(InvalidCoordinateException.class, () -> Geo.distanceKm(LatLon.of(90.5, 0), ok));
            assertThrows(InvalidCoordinateException.class, () -> Geo.distanceKm(ok, LatLon.of(0, -180.1)));
            assertThrows(InvalidCoordinateException.class, () -> Geo.distanceKm(null, ok));
        }
    }

    @Nested
    @DisplayName("Meter to degree conversion")
    class Conversion {

        @Test
        @DisplayName("Latitude degrees follow meters / R * 180/pi")
        void latitudeDegrees() {
            assertEquals(500 / 6_371_000.0 * (180 / Math.PI), Geo.metersToLatDegrees(500), 1e-15);
        }

        @Test
        @DisplayName("At the equator longitude and latitude steps coincide")
        void equatorLongitude() {
            assertEquals(Geo.metersToLatDegrees(500), Geo.metersToLonDegrees(500, 0), 1e-15);
        }

        @Test
        @DisplayName("Longitude step doubles at 60 degrees and is symmetric across the equator")
        void meridianConvergence() {
            double equator = Geo.metersToLonDegrees(1000, 0);
            assertEquals(2 * equator, Geo.metersToLonDegrees(1000, 60), 1e-12);
            assertEquals(Geo.metersToLonDegrees(1000, 45), Geo.metersToLonDegrees(1000, -45), 1e-15);
            assertTrue(Geo.metersToLonDegrees(1000, 50) > Geo.metersToLonDegrees(1000, 40));
        }

        @Test
        @DisplayName("Bad inputs are rejected")
        void badInputs() {
            assertThrows(InvalidParameterException.class, () -> Geo.metersToLatDegrees(Double.NaN));
            assertThrows(InvalidParameterException.class, () -> Geo.metersToLonDegrees(Double.POSITIVE_INFINITY, 0));
            assertThrows(InvalidCoordinateException.class, () -> Geo.metersToLonDegrees(100, 91));
        }
    }

    @Nested
    @DisplayName("Point in polygon")
    class Containment {

        @Test
        @DisplayName("Interior point is inside, exterior points are outside")
        void interiorAndExterior() {
            assertTrue(Geo.pointInPolygon(LatLon.of(0.5, 0.5), UNIT_SQUARE));
            assertFalse(Geo.pointInPolygon(LatLon.of(1.5, 0.5), UNIT_SQUARE));
            assertFalse(Geo.pointInPolygon(LatLon.of(0.5, -0.0001), UNIT_SQUARE));
        }

        @Test
        @DisplayName("Boundary counts as inside: every vertex and every edge")
        void boundaryInclusive() {
            for (LatLon v : UNIT_SQUARE.points()) {
                assertTrue(Geo.pointInPolygon(v, UNIT_SQUARE), "vertex " + v);
            }
            assertTrue(Geo.pointInPolygon(LatLon.of(0, 0.5), UNIT_SQUARE), "south edge");
            assertTrue(Geo.pointInPolygon(LatLon.of(1, 0.5), UNIT_SQUARE), "north edge");
            assertTrue(Geo.pointInPolygon(LatLon.of(0.5, 0), UNIT_SQUARE), "west edge");
            assertTrue(Geo.pointInPolygon(LatLon.of(0.5, 1), UNIT_SQUARE), "east edge");
        }

        @Test
        @DisplayName("Diagonal edge of a triangle is inside; just beyond it is outside")
        void diagonalEdge() {
            Polygon triangle = Polygon.of(LatLon.of(0, 0), LatLon.of(0, 2), LatLon.of(2, 0));
            assertTrue(Geo.pointInPolygon(LatLon.of(1, 1), triangle));
            assertFalse(Geo.pointInPolygon(LatLon.of(1.01, 1.01), triangle));
        }

        @Test
        @DisplayName("A point on the line through an edge but past its end is not on that edge")
        void collinearBeyondEdge() {
            LatLon a = LatLon.of(0, 0), b = LatLon.of(0, 1);
            assertTrue(Geo.onSegment(LatLon.of(0, 0.5), a, b));
            assertTrue(Geo.onSegment(b, a, b));
            assertFalse(Geo.onSegment(LatLon.of(0, 1.5), a, b));
            assertFalse(Geo.onSegment(LatLon.of(0, -0.5), a, b));

            Polygon triangle = Polygon.of(LatLon.of(0, 0), LatLon.of(0, 1), LatLon.of(1, 0));
            assertFalse(Geo.pointInPolygon(LatLon.of(0, 1.5), triangle));
        }

        @Test
        @DisplayName("Concave notch is outside")
        void concave() {
            // U shape opening north
            Polygon u = Polygon.of(
                LatLon.of(0, 0), LatLon.of(0, 3), LatLon.of(3, 3), LatLon.of(3, 2),
                LatLon.of(1, 2), LatLon.of(1, 1), LatLon.of(3, 1), LatLon.of(3, 0));
            assertFalse(Geo.pointInPolygon(LatLon.of(2, 1.5), u));
            assertTrue(Geo.pointInPolygon(LatLon.of(2, 0.5), u));
            assertTrue(Geo.pointInPolygon(LatLon.of(0.5, 1.5), u));
        }

        @Test
        @DisplayName("Vertex order does not matter")
        void orientation() {
            Polygon clockwise = Polygon.of(LatLon.of(0, 0), LatLon.of(1, 0), LatLon.of(1, 1), LatLon.of(0, 1));
            assertTrue(Geo.pointInPolygon(LatLon.of(0.25, 0.75), clockwise));
            assertFalse(Geo.pointInPolygon(LatLon.of(-0.25, 0.75), clockwise));
        }
    }
}
