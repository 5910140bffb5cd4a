package com.layoutmapper.mapping;

/**
 * Known component modules of the target UI library, keyed by a lower-case name keyword.
 * Declaration order is the lookup order.
 */
public enum ImportPathTable {
    BUTTON("button", "Button"),
    INPUT("input", "Input"),
    TEXTAREA("textarea", "Textarea"),
    SELECT("select", "Select"),
    CHECKBOX("checkbox", "Checkbox"),
    RADIO("radio", "Radio"),
    SWITCH("switch", "Switch"),
    MODAL("modal", "Modal"),
    DIALOG("dialog", "Dialog"),
    CARD("card", "Card"),
    TABLE("table", "Table"),
    DROPDOWN("dropdown", "Dropdown"),
    TOOLTIP("tooltip", "Tooltip"),
    POPUP("popup", "Popup"),
    TABS("tabs", "Tabs"),
    ACCORDION("accordion", "Accordion"),
    BADGE("badge", "Badge"),
    AVATAR("avatar", "Avatar"),
    ICON("icon", "Icon"),
    SPINNER("spinner", "Spinner"),
    PROGRESS("progress", "Progress"),
    SKELETON("skeleton", "Skeleton"),
    ALERT("alert", "Alert"),
    NOTIFICATION("notification", "Notification"),
    BREADCRUMBS("breadcrumbs", "Breadcrumbs"),
    PAGINATION("pagination", "Pagination"),
    STEPPER("stepper", "Stepper"),
    RATING("rating", "Rating"),
    SLIDER("slider", "Slider"),
    DATE_PICKER("datepicker", "DatePicker"),
    TIME_PICKER("timepicker", "TimePicker"),
    CALENDAR("calendar", "Calendar"),
    TREE("tree", "Tree"),
    MENU("menu", "Menu"),
    NAVBAR("navbar", "Navbar"),
    SIDEBAR("sidebar", "Sidebar"),
    FOOTER("footer", "Footer"),
    LAYOUT("layout", "Layout"),
    GRID("grid", "Grid"),
    FLEX("flex", "Flex"),
    STACK("stack", "Stack"),
    CONTAINER("container", "Container"),
    PAPER("paper", "Paper"),
    BOX("box", "Box"),
    FORM("form", "Form"),
    FORM_GROUP("formgroup", "FormGroup"),
    FORM_CONTROL("formcontrol", "FormControl"),
    FORM_LABEL("formlabel", "FormLabel"),
    FORM_HELPER_TEXT("formhelpertext", "FormHelperText"),
    FORM_ERROR_MESSAGE("formerrormessage", "FormErrorMessage");

    private final String keyword;
    private final String module;

    ImportPathTable(String keyword, String module) {
        this.keyword = keyword;
        this.module = module;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getModule() {
        return module;
    }
}
