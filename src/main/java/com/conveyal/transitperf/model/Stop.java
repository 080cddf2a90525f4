package com.conveyal.transitperf.model;

public class Stop extends Entity {

    private static final long serialVersionUID = 464065335273514677L;
    public String stop_id;
    public String stop_name;
    public double stop_lat;
    public double stop_lon;

    public Stop () { }

    public Stop (String stop_id, String stop_name, double stop_lat, double stop_lon) {
        this.stop_id = stop_id;
        this.stop_name = stop_name;
        this.stop_lat = stop_lat;
        this.stop_lon = stop_lon;
    }

    @Override
    public String getId () {
        return stop_id;
    }

}
