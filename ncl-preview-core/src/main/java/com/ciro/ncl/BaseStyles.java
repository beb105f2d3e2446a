package com.ciro.ncl;

/**
 * Hoja de estilos base del catálogo de componentes. Siempre va primero en el
 * {@code <style>} generado, antes del CSS del autor.
 */
public final class BaseStyles {

    private BaseStyles() {}

    public static final String CSS = """
        *, *::before, *::after { box-sizing: border-box; }
        body { margin: 0; padding: 1.5rem; font-family: system-ui, -apple-system, "Segoe UI", Roboto, sans-serif; color: #1f2937; background: #f9fafb; line-height: 1.5; }
        img { max-width: 100%; height: auto; }

        .btn { display: inline-flex; align-items: center; justify-content: center; gap: .5rem; border: 1px solid transparent; border-radius: .5rem; font-weight: 600; cursor: pointer; text-decoration: none; transition: background .15s, box-shadow .15s; }
        .btn:disabled { opacity: .5; cursor: not-allowed; }
        .btn-small { padding: .25rem .75rem; font-size: .875rem; }
        .btn-medium { padding: .5rem 1rem; font-size: 1rem; }
        .btn-large { padding: .75rem 1.5rem; font-size: 1.125rem; }
        .btn-primary { background: #4f46e5; color: #fff; }
        .btn-primary:hover { background: #4338ca; }
        .btn-secondary { background: #e5e7eb; color: #111827; }
        .btn-outline { background: transparent; border-color: #4f46e5; color: #4f46e5; }
        .btn-ghost { background: transparent; color: #4f46e5; }
        .btn-danger { background: #dc2626; color: #fff; }

        .form-field { display: flex; flex-direction: column; gap: .375rem; margin-bottom: 1rem; }
        .form-field label { font-size: .875rem; font-weight: 500; }
        .form-field label.has-error { color: #dc2626; }
        .input-wrap { position: relative; display: flex; align-items: center; }
        .input-icon { position: absolute; left: .75rem; pointer-events: none; }
        .form-input, .form-select { width: 100%; border: 1px solid #d1d5db; border-radius: .5rem; padding: .5rem .75rem; font: inherit; background: #fff; }
        .form-input:focus, .form-select:focus { outline: none; border-color: #4f46e5; box-shadow: 0 0 0 3px rgba(79, 70, 229, .2); }
        .form-input.has-icon { padding-left: 2.25rem; }
        .form-input-small { padding: .25rem .5rem; font-size: .875rem; }
        .form-input-large { padding: .75rem 1rem; font-size: 1.125rem; }
        .form-input.has-error, .form-select.has-error { border-color: #dc2626; }
        .form-field-filled .form-input { background: #f3f4f6; border-color: transparent; }
        .form-help { margin: 0; font-size: .75rem; color: #6b7280; }
        .form-error { margin: 0; font-size: .75rem; color: #dc2626; }
        .checkbox-field label { display: flex; align-items: center; gap: .5rem; }
        .toggle { display: inline-flex; align-items: center; gap: .5rem; cursor: pointer; }
        .toggle-input { position: absolute; opacity: 0; }
        .toggle-track { width: 2.5rem; height: 1.25rem; border-radius: 9999px; background: #d1d5db; transition: background .15s; }
        .toggle-input:checked + .toggle-track { background: #4f46e5; }
        .form-group { margin-bottom: 1rem; }
        .form-group-set { border: 1px solid #e5e7eb; border-radius: .75rem; padding: 1rem; margin-bottom: 1rem; }
        .nucleus-form { display: block; }
        .wizard-step { border: 0; padding: 0; margin: 0 0 1.5rem; }
        .wizard-step legend { font-size: 1.125rem; font-weight: 600; margin-bottom: 1rem; }

        .grid { display: grid; gap: 1rem; }
        .grid-cols-1 { grid-template-columns: repeat(1, minmax(0, 1fr)); }
        .grid-cols-2 { grid-template-columns: repeat(2, minmax(0, 1fr)); }
        .grid-cols-3 { grid-template-columns: repeat(3, minmax(0, 1fr)); }
        .grid-cols-4 { grid-template-columns: repeat(4, minmax(0, 1fr)); }

        .card { background: #fff; border: 1px solid #e5e7eb; border-radius: .75rem; padding: 1.25rem; box-shadow: 0 1px 2px rgba(0, 0, 0, .05); }
        .card-elevated { box-shadow: 0 10px 25px rgba(0, 0, 0, .08); }
        .card-outline { box-shadow: none; }
        .card.glass, .card-glass { background: rgba(255, 255, 255, .6); backdrop-filter: blur(12px); border-color: rgba(255, 255, 255, .4); }

        .badge { display: inline-flex; align-items: center; gap: .25rem; padding: .125rem .5rem; border-radius: 9999px; font-size: .75rem; font-weight: 600; background: #e5e7eb; color: #374151; }
        .badge-primary { background: #e0e7ff; color: #3730a3; }
        .badge-success { background: #dcfce7; color: #166534; }
        .badge-warning { background: #fef3c7; color: #92400e; }
        .badge-danger { background: #fee2e2; color: #991b1b; }

        .stat-card { background: #fff; border: 1px solid #e5e7eb; border-radius: .75rem; padding: 1.25rem; }
        .stat-card.highlight { border-color: #4f46e5; box-shadow: 0 0 0 3px rgba(79, 70, 229, .15); }
        .stat-value { font-size: 1.75rem; font-weight: 700; }
        .stat-label { font-size: .875rem; color: #6b7280; }
        .stat-trend { font-size: .75rem; font-weight: 600; }
        .trend-up { color: #16a34a; }
        .trend-down { color: #dc2626; }

        .feature-card { background: #fff; border: 1px solid #e5e7eb; border-radius: .75rem; padding: 1.5rem; }
        .feature-icon { font-size: 2rem; margin-bottom: .5rem; }
        .feature-title { margin: 0 0 .25rem; font-size: 1.125rem; }
        .feature-description { margin: 0; color: #6b7280; }

        .nav-item { display: flex; align-items: center; gap: .5rem; padding: .5rem .75rem; border-radius: .5rem; color: #374151; text-decoration: none; }
        .nav-item:hover { background: #f3f4f6; }
        .nav-item.active { background: #eef2ff; color: #4338ca; font-weight: 600; }

        [data-island] { position: relative; }
        .n-even { transition: color .15s; }
        .n-odd { transition: color .15s; }
        .island-error { border: 1px solid #fca5a5; background: #fef2f2; color: #991b1b; border-radius: .5rem; padding: .75rem; font-family: ui-monospace, monospace; font-size: .875rem; }
        """;
}
