package dev.holdem.handflow;

import dev.holdem.handflow.proto.PublicTableView;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingListener implements StateChangeListener {

    private final List<PublicTableView> views = new CopyOnWriteArrayList<>();

    @Override
    public void notifyStateChanged(String tableId, PublicTableView view) {
        views.add(view);
    }

    public List<PublicTableView> getViews() {
        return views;
    }

    /** Most recent view published for the given audience, or null. */
    public PublicTableView latest(int viewerSeat) {
        for (int i = views.size() - 1; i >= 0; i--) {
            if (views.get(i).getViewerSeat() == viewerSeat) {
                return views.get(i);
            }
        }
        return null;
    }
}
