package salesman.problem;

import com.vividsolutions.jts.geom.Coordinate;

public final class City {

	private final int x, y;
	private final int tag;

	public City(int x, int y, int tag) {
		this.x = x;
		this.y = y;
		this.tag = tag;
	}

	public int getX() {
		return x;
	}

	public int getY() {
		return y;
	}

	public int getTag() {
		return tag;
	}

	public Coordinate toCoordinate() {
		return new Coordinate(x, y);
	}

	public double distance(City c) {
		return toCoordinate().distance(c.toCoordinate());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof City))
			return false;
		City c = (City) o;
		return x == c.x && y == c.y && tag == c.tag;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * x + y) + tag;
	}

	@Override
	public String toString() {
		return "City" + tag + "(" + x + "," + y + ")";
	}
}
