package com.connectpro.observability;

import com.connectpro.channels.Transport;
import com.connectpro.store.RecordStore;
import com.connectpro.tenants.TenantRegistry;

import java.util.ArrayList;

public class DoctorCommand {

    private final RecordStore store;
    private final TenantRegistry registry;
    private final Transport frontDoor;

    public DoctorCommand(RecordStore store, TenantRegistry registry, Transport frontDoor) {
        this.store = store;
        this.registry = registry;
        this.frontDoor = frontDoor;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkFrontDoor());
        results.add(checkStoreAndTenants());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkFrontDoor() {
        var username = frontDoor.botUsername();
        return username != null
                ? "[OK] Front door @" + username
                : "[FAIL] Front door not open";
    }

    private String checkStoreAndTenants() {
        int eligible;
        try {
            eligible = store.listActiveDedicatedOwners().size();
        } catch (Exception e) {
            return "[FAIL] Record store: " + e.getMessage();
        }
        int live = registry.size();
        return live >= eligible
                ? "[OK] Record store; dedicated bots live " + live + "/" + eligible
                : "[WARN] Record store; dedicated bots live " + live + "/" + eligible;
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
