/*
 * Copyright 2025 devteam@scivics-lab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.execgateway.facts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.scivicslab.execgateway.result.OutcomeRecord;
import com.scivicslab.execgateway.result.ResultSet;

/**
 * Reshapes the output of the {@code setup} facts module into
 * {@link HostInfo} records.
 *
 * <p>Only the ok bucket is read. Memory is converted from MB to whole GB.
 * Disk capacity is the sum over block devices whose name starts with
 * {@code sd}, {@code hd}, {@code ss} or {@code vd}, in GB. Network details are
 * reported for {@code eth}, {@code bond}, {@code bind}, {@code eno},
 * {@code ens}, {@code em} and {@code ib} interfaces and for {@code lo}.</p>
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public class FactsSummarizer {

    private static final List<String> DISK_PREFIXES = List.of("sd", "hd", "ss", "vd");

    private static final Pattern INTERFACE_NAME = Pattern.compile("^(eth|bond|bind|eno|ens|em|ib)\\d*");

    private static final String LOOPBACK = "lo";

    private static final Pattern DISK_SIZE = Pattern.compile("^\\s*([0-9]+(?:\\.[0-9]+)?)\\s*([GT])");

    /**
     * Summarizes every ok outcome of a facts run.
     *
     * @param results the result set of a {@code setup} run
     * @return one record per ok outcome, in bucket order
     */
    public List<HostInfo> summarize(ResultSet results) {
        List<HostInfo> infos = new ArrayList<>();
        for (OutcomeRecord record : results.getOk()) {
            infos.add(summarize(record));
        }
        return infos;
    }

    HostInfo summarize(OutcomeRecord record) {
        Map<String, Object> facts = asMap(record.getPayload().get("ansible_facts"));
        Map<String, Object> info = new LinkedHashMap<>();

        info.put(HostInfo.HOST, record.getHost());
        info.put(HostInfo.HOSTNAME, text(facts.get("ansible_hostname")));
        info.put(HostInfo.CPU_MODEL, lastElement(facts.get("ansible_processor")));
        info.put(HostInfo.CPU_NUMBER, integer(facts.get("ansible_processor_count")));
        info.put(HostInfo.VCPU_NUMBER, integer(facts.get("ansible_processor_vcpus")));
        info.put(HostInfo.KERNEL, text(facts.get("ansible_kernel")));
        info.put(HostInfo.SYSTEM, system(facts));
        info.put(HostInfo.SERVER_MODEL, text(facts.get("ansible_product_name")));
        info.put(HostInfo.RAM_TOTAL, megabytesToGigabytes(facts.get("ansible_memtotal_mb")));
        info.put(HostInfo.SWAP_TOTAL, megabytesToGigabytes(facts.get("ansible_swaptotal_mb")));
        info.put(HostInfo.DISK_TOTAL, diskTotal(facts.get("ansible_devices")));
        info.put(HostInfo.FILESYSTEMS, filesystems(facts.get("ansible_mounts")));
        info.put(HostInfo.INTERFACES, interfaces(facts));

        return new HostInfo(info);
    }

    private static Object system(Map<String, Object> facts) {
        List<String> parts = new ArrayList<>();
        for (String key : List.of("ansible_distribution", "ansible_distribution_version",
                                  "ansible_userspace_architecture")) {
            Object value = facts.get(key);
            if (value != null) {
                parts.add(value.toString());
            }
        }
        return parts.isEmpty() ? HostInfo.UNKNOWN : String.join(" ", parts);
    }

    private static Object diskTotal(Object devices) {
        if (!(devices instanceof Map)) {
            return HostInfo.UNKNOWN;
        }
        double total = 0;
        for (Map.Entry<String, Object> device : asMap(devices).entrySet()) {
            String name = device.getKey();
            if (name.length() < 2 || !DISK_PREFIXES.contains(name.substring(0, 2))) {
                continue;
            }
            Object size = asMap(device.getValue()).get("size");
            if (size == null) {
                continue;
            }
            Matcher matcher = DISK_SIZE.matcher(size.toString());
            if (!matcher.find()) {
                continue;
            }
            double value = Double.parseDouble(matcher.group(1));
            if ("T".equals(matcher.group(2))) {
                value *= 1024;
            }
            total += round2(value);
        }
        return round2(total);
    }

    private static Object filesystems(Object mounts) {
        if (!(mounts instanceof List)) {
            return HostInfo.UNKNOWN;
        }
        List<Map<String, Object>> filesystems = new ArrayList<>();
        for (Object mount : (List<?>) mounts) {
            Map<String, Object> source = asMap(mount);
            Map<String, Object> fs = new LinkedHashMap<>();
            fs.put("mount", orUnknown(source.get("mount")));
            fs.put("size_total", orUnknown(source.get("size_total")));
            fs.put("size_available", orUnknown(source.get("size_available")));
            fs.put("fstype", orUnknown(source.get("fstype")));
            filesystems.add(fs);
        }
        return filesystems;
    }

    private static Object interfaces(Map<String, Object> facts) {
        Object names = facts.get("ansible_interfaces");
        if (!(names instanceof List)) {
            return HostInfo.UNKNOWN;
        }
        List<Map<String, Object>> interfaces = new ArrayList<>();
        for (Object item : (List<?>) names) {
            String name = String.valueOf(item);
            if (!LOOPBACK.equals(name) && !INTERFACE_NAME.matcher(name).lookingAt()) {
                continue;
            }
            // setup reports per-interface facts with dashes turned into underscores
            Map<String, Object> source = asMap(facts.get("ansible_" + name.replace('-', '_')));
            Map<String, Object> nic = new LinkedHashMap<>();
            nic.put("network_card_name", orUnknown(source.get("device")));
            nic.put("network_card_mac", orUnknown(source.get("macaddress")));
            nic.put("network_card_ipv4", orUnknown(source.get("ipv4")));
            nic.put("network_card_ipv4_secondaries", orUnknown(source.get("ipv4_secondaries")));
            nic.put("network_card_ipv6", orUnknown(source.get("ipv6")));
            nic.put("network_card_model", orUnknown(source.get("type")));
            nic.put("network_card_mtu", orUnknown(source.get("mtu")));
            nic.put("network_card_status", orUnknown(source.get("active")));
            nic.put("network_card_speed", orUnknown(source.get("speed")));
            interfaces.add(nic);
        }
        return interfaces;
    }

    private static Object megabytesToGigabytes(Object megabytes) {
        Object value = integer(megabytes);
        if (!(value instanceof Integer)) {
            return HostInfo.UNKNOWN;
        }
        return Math.round((Integer) value / 1024.0);
    }

    private static Object integer(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return HostInfo.UNKNOWN;
            }
        }
        return HostInfo.UNKNOWN;
    }

    private static Object text(Object value) {
        return value == null ? HostInfo.UNKNOWN : value.toString();
    }

    private static Object orUnknown(Object value) {
        return value == null ? HostInfo.UNKNOWN : value;
    }

    private static Object lastElement(Object value) {
        if (value instanceof List && !((List<?>) value).isEmpty()) {
            List<?> list = (List<?>) value;
            return String.valueOf(list.get(list.size() - 1));
        }
        return HostInfo.UNKNOWN;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    private static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
