package salesman.utils;

import com.vividsolutions.jts.geom.Coordinate;
import com.vividsolutions.jts.geom.GeometryFactory;
import com.vividsolutions.jts.geom.LinearRing;
import com.vividsolutions.jts.io.WKTWriter;

import salesman.problem.Problem;
import salesman.problem.Tour;

public class TourExport {

	private static final GeometryFactory gf = new GeometryFactory();

	private TourExport() {
	}

	public static LinearRing toLinearRing(Problem p, Tour t) {
		Coordinate[] coords = new Coordinate[t.size() + 1];
		for (int i = 0; i < t.size(); i++)
			coords[i] = p.getCity(t.get(i)).toCoordinate();
		coords[t.size()] = new Coordinate(coords[0]);
		return gf.createLinearRing(coords);
	}

	public static String toWkt(Problem p, Tour t) {
		return new WKTWriter().write(toLinearRing(p, t));
	}
}
