package com.conveyal.transitperf.model;

public class Route extends Entity {

    private static final long serialVersionUID = -3518273464235124316L;
    public String route_id;
    public String route_short_name;
    public String route_long_name;

    public Route () { }

    public Route (String route_id, String route_short_name, String route_long_name) {
        this.route_id = route_id;
        this.route_short_name = route_short_name;
        this.route_long_name = route_long_name;
    }

    @Override
    public String getId () {
        return route_id;
    }

    /** @return the short name if there is one, otherwise the long name, otherwise the ID. */
    public String getDisplayName () {
        if (route_short_name != null && !route_short_name.isEmpty()) return route_short_name;
        if (route_long_name != null && !route_long_name.isEmpty()) return route_long_name;
        return route_id;
    }

}
